package com.demo.eligibility.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record CategoryScores(
        @JsonProperty("personal_info") double personalInfo,
        @JsonProperty("employment") double employment,
        @JsonProperty("income") double income,
        @JsonProperty("assets") double assets,
        @JsonProperty("credit") double credit
) {
    public static final CategoryScores ZERO = new CategoryScores(0, 0, 0, 0, 0);

    public List<Double> values() {
        return List.of(personalInfo, employment, income, assets, credit);
    }
}
