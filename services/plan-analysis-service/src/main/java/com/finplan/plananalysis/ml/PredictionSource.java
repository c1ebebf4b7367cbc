package com.finplan.plananalysis.ml;

/**
 * Predictor layer that produced a tag.
 */
public enum PredictionSource {
    USER,
    GLOBAL,
    BASELINE,
    NONE
}
