package com.demo.eligibility.model;

public record DecisionFinding(
        FindingCategory category,
        Severity severity,
        String message,
        double weight
) {}
