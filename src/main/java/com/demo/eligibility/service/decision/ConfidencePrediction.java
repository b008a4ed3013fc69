package com.demo.eligibility.service.decision;

/** Approval probability in [0, 1] and the class it implies. */
public record ConfidencePrediction(double probability, int predictedClass) {

    public static ConfidencePrediction of(double probability) {
        double p = Double.isNaN(probability) ? 0.0 : Math.max(0.0, Math.min(1.0, probability));
        return new ConfidencePrediction(p, p >= 0.5 ? 1 : 0);
    }
}
