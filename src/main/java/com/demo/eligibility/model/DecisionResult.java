package com.demo.eligibility.model;

import java.time.Instant;
import java.util.List;

/**
 * Final eligibility decision for one application. Terminal: created once, never updated.
 */
public record DecisionResult(
        String applicationId,
        DecisionStatus finalDecision,
        DecisionScore decisionScores,
        List<DecisionFinding> findings,
        String rationale,
        ConfidenceLevel confidenceLevel,
        boolean appealsEligible,
        List<String> recommendedActions,
        List<String> criticalFlags,
        int mlPredictionClass,
        String validationStatus,
        Instant timestamp
) {
    public DecisionResult {
        findings = findings == null ? List.of() : List.copyOf(findings);
        recommendedActions = recommendedActions == null ? List.of() : List.copyOf(recommendedActions);
        criticalFlags = criticalFlags == null ? List.of() : List.copyOf(criticalFlags);
    }
}
