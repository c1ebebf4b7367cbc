package com.finplan.plananalysis.model;

/**
 * Auto-approval policy shared by every analysis node.
 *
 * <p>Nodes at or above {@link #AUTO_APPROVAL_THRESHOLD} are auto-approved, anything
 * below needs a user review. The threshold is fixed and not configurable.
 */
public final class Confidence {

    public static final double AUTO_APPROVAL_THRESHOLD = 0.80;

    private Confidence() {
    }

    public static boolean needsReview(double confidence) {
        return confidence < AUTO_APPROVAL_THRESHOLD;
    }

    public static boolean isAutoApproved(double confidence) {
        return !needsReview(confidence);
    }

    public static double mean(double first, double second) {
        return (first + second) / 2.0;
    }
}
