package com.demo.eligibility.service.dto;

import com.demo.eligibility.model.CategoryScores;
import com.demo.eligibility.model.ValidationFinding;
import com.demo.eligibility.model.ValidationResult;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Wire form of a validation outcome, and the input the decision engine reads. Absent keys
 * read as zero or empty.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ValidationRecord {

    @JsonProperty("application_id")
    private String applicationId;

    @JsonProperty("validation_status")
    private String validationStatus;

    @JsonProperty("quality_score")
    private double qualityScore;

    @JsonProperty("consistency_score")
    private double consistencyScore;

    @JsonProperty("completeness_score")
    private double completenessScore;

    @JsonProperty("category_scores")
    private CategoryScores categoryScores;

    private List<FindingItem> findings = new ArrayList<>();

    @JsonProperty("documents_reviewed")
    private int documentsReviewed;

    public static ValidationRecord from(ValidationResult result) {
        ValidationRecord r = new ValidationRecord();
        r.applicationId = result.applicationId();
        r.validationStatus = result.validationStatus().code();
        r.qualityScore = result.qualityScore();
        r.consistencyScore = result.consistencyScore();
        r.completenessScore = result.completenessScore();
        r.categoryScores = result.categoryScores();
        r.findings = result.findings().stream().map(FindingItem::from).toList();
        r.documentsReviewed = result.documentsValidated();
        return r;
    }

    public CategoryScores categoryScoresOrZero() {
        return categoryScores == null ? CategoryScores.ZERO : categoryScores;
    }

    public List<FindingItem> findingsOrEmpty() {
        return findings == null ? List.of() : findings;
    }

    /** A finding as stored in the results file; older files hold bare message strings. */
    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FindingItem {
        private String category;
        private String severity;
        @JsonProperty("finding_type")
        private String findingType;
        private String message;
        @JsonProperty("auto_resolvable")
        private boolean autoResolvable;
        @JsonProperty("suggested_resolution")
        private String suggestedResolution;

        /** Picked up by Jackson for bare string entries; objects still bind through the setters. */
        public static FindingItem valueOf(String text) {
            FindingItem f = new FindingItem();
            f.message = text;
            return f;
        }

        static FindingItem from(ValidationFinding finding) {
            FindingItem f = new FindingItem();
            f.category = finding.category().code();
            f.severity = finding.severity().code();
            f.findingType = finding.findingType();
            f.message = finding.message();
            f.autoResolvable = finding.autoResolvable();
            f.suggestedResolution = finding.suggestedResolution();
            return f;
        }
    }
}
