package com.finplan.plananalysis.ml;

import com.finplan.plananalysis.model.ItemTag;

public record TagPrediction(ItemTag tag, double confidence, PredictionSource source) {

    public static final double UNKNOWN_CONFIDENCE = 0.30;

    public static TagPrediction unknown() {
        return new TagPrediction(ItemTag.UNKNOWN, UNKNOWN_CONFIDENCE, PredictionSource.NONE);
    }
}
