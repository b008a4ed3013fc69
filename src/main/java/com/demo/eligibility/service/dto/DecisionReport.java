package com.demo.eligibility.service.dto;

import com.demo.eligibility.service.decision.DecisionSummary;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.time.Instant;
import java.util.List;

@Data
public class DecisionReport {

    @JsonProperty("generated_at")
    private Instant generatedAt;

    private DecisionSummary summary;

    private List<DecisionResponse> decisions;
}
