package com.demo.eligibility.repository;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/** One row of the ground-truth table. Only the columns used for back-fill are mapped. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class GroundTruthRecord {

    @JsonProperty("application_id")
    private String applicationId;

    @JsonProperty("full_name")
    private String fullName;

    @JsonProperty("emirates_id")
    private String emiratesId;

    // kept as text: the column is sometimes blank or "35.0"
    @JsonProperty("age")
    private String age;

    @JsonProperty("marital_status")
    private String maritalStatus;

    public Integer ageYears() {
        if (age == null || age.isBlank()) return null;
        try {
            return (int) Double.parseDouble(age.strip());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** 1 January of the birth year implied by {@code age} on {@code today}. */
    public LocalDate approximateDateOfBirth(LocalDate today) {
        Integer years = ageYears();
        if (years == null || years < 0) return null;
        return LocalDate.of(today.getYear() - years, 1, 1);
    }
}
