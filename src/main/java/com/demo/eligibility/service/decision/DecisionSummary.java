package com.demo.eligibility.service.decision;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/** Batch totals: decision counts and shares, confidence spread, mean scores. */
public record DecisionSummary(
        @JsonProperty("total_applications") int totalApplications,
        @JsonProperty("decisions") Map<String, Integer> decisions,
        @JsonProperty("decision_percentages") Map<String, Double> decisionPercentages,
        @JsonProperty("confidence_distribution") Map<String, Integer> confidenceDistribution,
        @JsonProperty("average_scores") Map<String, Double> averageScores,
        @JsonProperty("appeals_eligible") int appealsEligible
) {}
