package com.demo.eligibility.service.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ValidationResultsDocument {

    @JsonProperty("generated_at")
    private Instant generatedAt;

    @JsonProperty("total_applications")
    private int totalApplications;

    private List<ValidationRecord> applications = new ArrayList<>();
}
