package com.finplan.plananalysis.ml;

import com.finplan.plananalysis.model.ItemTag;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * One user's learned corrections, consulted before the shared layers.
 */
public class UserTagOverlay {

    private final UUID userId;
    private final TagMemory memory = new TagMemory();

    public UserTagOverlay(UUID userId) {
        this.userId = userId;
    }

    public UUID getUserId() {
        return userId;
    }

    public Optional<ItemTag> lookup(String term) {
        return memory.lookup(term);
    }

    public void learn(String term, ItemTag tag) {
        memory.learn(term, tag);
    }

    public void learnBatch(List<LearnedCorrection> corrections) {
        memory.learnBatch(corrections);
    }

    public int size() {
        return memory.size();
    }
}
