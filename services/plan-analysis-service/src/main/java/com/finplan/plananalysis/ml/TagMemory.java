package com.finplan.plananalysis.ml;

import com.finplan.plananalysis.model.ItemTag;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Learned term to tag memory for one predictor layer.
 *
 * <p>Entries live in an immutable map published through a volatile reference. Readers
 * never lock and always see a complete map; writers copy the current map, apply
 * their change and publish the copy while holding {@link #writeLock}, so a batch is
 * visible either entirely or not at all. The latest write for a term wins.
 */
public class TagMemory {

    private final ReentrantLock writeLock = new ReentrantLock();
    private volatile Map<String, ItemTag> entries = Map.of();

    public Optional<ItemTag> lookup(String term) {
        return Optional.ofNullable(entries.get(TermNormalizer.normalize(term)));
    }

    public void learn(String term, ItemTag tag) {
        learnBatch(List.of(new LearnedCorrection(term, tag)));
    }

    /**
     * Applies every correction, in order, as one atomic publication.
     *
     * @throws IllegalArgumentException if any correction has a blank term or no tag;
     *                                  nothing is applied in that case
     */
    public void learnBatch(List<LearnedCorrection> corrections) {
        Map<String, ItemTag> normalized = validate(corrections);
        if (normalized.isEmpty()) {
            return;
        }
        writeLock.lock();
        try {
            Map<String, ItemTag> next = new HashMap<>(entries);
            next.putAll(normalized);
            entries = Map.copyOf(next);
        } finally {
            writeLock.unlock();
        }
    }

    public int size() {
        return entries.size();
    }

    public Map<String, ItemTag> snapshot() {
        return entries;
    }

    private static Map<String, ItemTag> validate(List<LearnedCorrection> corrections) {
        Map<String, ItemTag> normalized = new HashMap<>();
        for (LearnedCorrection correction : corrections) {
            String term = TermNormalizer.normalize(correction.term());
            if (term.isEmpty()) {
                throw new IllegalArgumentException("Cannot learn a blank term");
            }
            if (correction.tag() == null) {
                throw new IllegalArgumentException("Cannot learn term '" + term + "' without a tag");
            }
            normalized.put(term, correction.tag());
        }
        return normalized;
    }
}
