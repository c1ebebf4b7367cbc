package com.finplan.plananalysis.engine;

import java.security.SecureRandom;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.Set;

/**
 * Issues 8-hex-character node ids, unique within one tree build.
 * Not thread-safe; create one per build.
 */
final class NodeIdGenerator {

    private static final SecureRandom RANDOM = new SecureRandom();
    private static final HexFormat HEX = HexFormat.of();

    private final Set<String> issued = new HashSet<>();

    String next() {
        byte[] bytes = new byte[4];
        String id;
        do {
            RANDOM.nextBytes(bytes);
            id = HEX.formatHex(bytes);
        } while (!issued.add(id));
        return id;
    }
}
