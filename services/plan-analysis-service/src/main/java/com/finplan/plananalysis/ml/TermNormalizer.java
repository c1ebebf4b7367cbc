package com.finplan.plananalysis.ml;

import java.util.Locale;

public final class TermNormalizer {

    private TermNormalizer() {
    }

    /**
     * Trimmed, lower-cased term; the empty string for null.
     */
    public static String normalize(String term) {
        return term == null ? "" : term.trim().toLowerCase(Locale.ROOT);
    }
}
