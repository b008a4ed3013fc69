package com.demo.eligibility.model;

import java.util.List;

/**
 * Detailed, in-process validation outcome. The wire form read by the decision engine is
 * {@link com.demo.eligibility.service.dto.ValidationRecord}.
 */
public record ValidationResult(
        String applicationId,
        double qualityScore,
        double consistencyScore,
        double completenessScore,
        CategoryScores categoryScores,
        List<ValidationFinding> findings,
        ValidationStatus validationStatus,
        int documentsValidated
) {
    public ValidationResult {
        findings = findings == null ? List.of() : List.copyOf(findings);
    }
}
