package com.demo.eligibility.service.decision;

import com.demo.eligibility.model.CategoryScores;
import com.demo.eligibility.service.dto.ValidationRecord;

import java.util.ArrayList;
import java.util.List;

/** Hand-built validation records for decision tests. */
final class ValidationRecords {

    private ValidationRecords() {}

    static ValidationRecord record(String id, double quality, double consistency, double completeness,
                                   CategoryScores categories, int documents, String... findingMessages) {
        ValidationRecord r = new ValidationRecord();
        r.setApplicationId(id);
        r.setValidationStatus("passed");
        r.setQualityScore(quality);
        r.setConsistencyScore(consistency);
        r.setCompletenessScore(completeness);
        r.setCategoryScores(categories);
        r.setDocumentsReviewed(documents);
        List<ValidationRecord.FindingItem> findings = new ArrayList<>();
        for (String m : findingMessages) findings.add(ValidationRecord.FindingItem.valueOf(m));
        r.setFindings(findings);
        return r;
    }

    static CategoryScores uniform(double v) {
        return new CategoryScores(v, v, v, v, v);
    }
}
