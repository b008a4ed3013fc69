package com.demo.eligibility.service.validation;

import com.demo.eligibility.model.ApplicationExtraction;
import com.demo.eligibility.model.CategoryScores;
import com.demo.eligibility.model.DocumentKind;
import com.demo.eligibility.model.ExtractionMetadata;
import com.demo.eligibility.model.ExtractionStatus;
import com.demo.eligibility.model.FindingCategory;
import com.demo.eligibility.model.Severity;
import com.demo.eligibility.model.ValidationFinding;
import com.demo.eligibility.model.ValidationResult;
import com.demo.eligibility.model.ValidationStatus;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Turns findings into the quality, consistency and completeness scores and the validation
 * status. Every score is clamped to [0, 1].
 */
@Component
public class ScoreAggregator {

    public static final double W_PERSONAL = 0.15;
    public static final double W_EMPLOYMENT = 0.15;
    public static final double W_INCOME = 0.25;
    public static final double W_ASSETS = 0.20;
    public static final double W_CREDIT = 0.25;

    /** Score of an optional category whose document yielded nothing. */
    static final double UNKNOWN_CATEGORY = 0.5;
    static final double REVIEW_QUALITY = 0.6;

    public ValidationResult aggregate(ApplicationExtraction app, List<ValidationFinding> findings) {
        CategoryScores categories = new CategoryScores(
                categoryScore(findings, FindingCategory.PERSONAL_INFO),
                extracted(app, DocumentKind.EMPLOYMENT_LETTER)
                        ? categoryScore(findings, FindingCategory.EMPLOYMENT) : UNKNOWN_CATEGORY,
                hasIncomeSource(app) ? categoryScore(findings, FindingCategory.INCOME) : 0.0,
                extracted(app, DocumentKind.ASSET_LIABILITY_SHEET)
                        ? categoryScore(findings, FindingCategory.ASSETS) : UNKNOWN_CATEGORY,
                extracted(app, DocumentKind.CREDIT_REPORT)
                        ? categoryScore(findings, FindingCategory.CREDIT) : UNKNOWN_CATEGORY);

        double quality = clamp(W_PERSONAL * categories.personalInfo()
                + W_EMPLOYMENT * categories.employment()
                + W_INCOME * categories.income()
                + W_ASSETS * categories.assets()
                + W_CREDIT * categories.credit());

        return new ValidationResult(
                app.applicationId(),
                quality,
                consistencyScore(findings),
                completenessScore(app),
                categories,
                findings,
                status(findings, quality),
                app.documentsPresent());
    }

    static double categoryScore(List<ValidationFinding> findings, FindingCategory category) {
        double penalty = findings.stream()
                .filter(f -> f.category() == category)
                .mapToDouble(f -> f.severity().penalty())
                .sum();
        return clamp(1.0 - penalty);
    }

    static double consistencyScore(List<ValidationFinding> findings) {
        double penalty = findings.stream()
                .filter(f -> !f.severity().isInformational())
                .mapToDouble(f -> f.severity().penalty())
                .sum();
        return clamp(1.0 - penalty);
    }

    static double completenessScore(ApplicationExtraction app) {
        return clamp(Arrays.stream(DocumentKind.values())
                .filter(app::isPresent)
                .mapToDouble(DocumentKind::completenessWeight)
                .sum());
    }

    /** Failed iff any critical finding; high findings or low quality need review. */
    static ValidationStatus status(List<ValidationFinding> findings, double quality) {
        boolean critical = findings.stream().anyMatch(f -> f.severity() == Severity.CRITICAL);
        if (critical) return ValidationStatus.FAILED;
        boolean high = findings.stream().anyMatch(f -> f.severity().isAtLeast(Severity.HIGH));
        if (high || quality < REVIEW_QUALITY) return ValidationStatus.NEEDS_REVIEW;
        return findings.isEmpty() ? ValidationStatus.PASSED : ValidationStatus.PASSED_WITH_WARNINGS;
    }

    private static boolean extracted(ApplicationExtraction app, DocumentKind kind) {
        ExtractionMetadata m = app.metadata().get(kind);
        return m != null && (m.status() == ExtractionStatus.SUCCESS || m.status() == ExtractionStatus.PARTIAL);
    }

    private static boolean hasIncomeSource(ApplicationExtraction app) {
        Double salary = app.employmentInfo().monthlySalary();
        Double bank = app.bankMonthlyIncome();
        return (salary != null && salary > 0) || (bank != null && bank > 0);
    }

    private static double clamp(double v) {
        if (Double.isNaN(v)) return 0.0;
        return Math.max(0.0, Math.min(1.0, v));
    }
}
