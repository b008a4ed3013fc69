package com.demo.eligibility.model;

/**
 * Derived decision signals, each clamped to [0, 1] on construction.
 */
public record DecisionScore(
        double validationScore,
        double mlConfidence,
        double businessRuleScore,
        double combinedScore,
        double approvalLikelihood
) {
    public static final DecisionScore ZERO = new DecisionScore(0, 0, 0, 0, 0);

    public DecisionScore {
        validationScore = clamp(validationScore);
        mlConfidence = clamp(mlConfidence);
        businessRuleScore = clamp(businessRuleScore);
        combinedScore = clamp(combinedScore);
        approvalLikelihood = clamp(approvalLikelihood);
    }

    public static double clamp(double v) {
        if (Double.isNaN(v)) return 0.0;
        return Math.max(0.0, Math.min(1.0, v));
    }
}
