package com.finplan.plananalysis.ml;

import com.finplan.plananalysis.model.ItemTag;

/**
 * A term to tag association ready to be applied to a {@link TagMemory}.
 */
public record LearnedCorrection(String term, ItemTag tag) {
}
