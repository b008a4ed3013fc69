package com.demo.eligibility.service.decision;

import com.demo.eligibility.model.DecisionFinding;
import com.demo.eligibility.model.FindingCategory;
import com.demo.eligibility.model.Severity;
import com.demo.eligibility.service.dto.ValidationRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Hard eligibility rules. The score starts at 1.0 and each failed rule deducts its weight;
 * the result never drops below zero.
 */
@Component
public class BusinessRuleEvaluator {

    public static final double MIN_QUALITY = 0.70;
    public static final double PREFERRED_QUALITY = 0.85;
    public static final double INCOME_STABILITY = 0.70;
    public static final int REQUIRED_DOCUMENTS = 6;

    static final double MIN_QUALITY_PENALTY = 0.30;
    static final double PREFERRED_QUALITY_PENALTY = 0.15;
    static final double INCOME_PENALTY = 0.20;
    static final double DEBT_BURDEN_PENALTY = 0.25;
    static final double DOCUMENTS_PENALTY = 0.10;

    public record Outcome(double score, List<DecisionFinding> findings) {}

    public Outcome evaluate(ValidationRecord v) {
        List<DecisionFinding> findings = new ArrayList<>();
        double score = 1.0;

        double quality = v.getQualityScore();
        if (quality < MIN_QUALITY) {
            findings.add(rule(Severity.CRITICAL, String.format(Locale.ROOT,
                    "Quality score %.2f below minimum threshold 0.70", quality), MIN_QUALITY_PENALTY));
            score -= MIN_QUALITY_PENALTY;
        } else if (quality < PREFERRED_QUALITY) {
            findings.add(rule(Severity.HIGH, String.format(Locale.ROOT,
                    "Quality score %.2f below preferred threshold 0.85", quality), PREFERRED_QUALITY_PENALTY));
            score -= PREFERRED_QUALITY_PENALTY;
        }

        // a zero income score means no income data at all; that case is covered by quality
        double income = v.categoryScoresOrZero().income();
        if (income > 0 && income < INCOME_STABILITY) {
            findings.add(rule(Severity.HIGH, String.format(Locale.ROOT,
                    "Income stability %.2f below threshold 0.7", income), INCOME_PENALTY));
            score -= INCOME_PENALTY;
        }

        Optional<String> debt = firstDebtBurdenMessage(v);
        if (debt.isPresent()) {
            findings.add(rule(Severity.HIGH, "Critical debt burden detected: " + debt.get(), DEBT_BURDEN_PENALTY));
            score -= DEBT_BURDEN_PENALTY;
        }

        int documents = v.getDocumentsReviewed();
        if (documents < REQUIRED_DOCUMENTS) {
            findings.add(rule(Severity.MEDIUM,
                    "Incomplete documentation: " + documents + "/" + REQUIRED_DOCUMENTS + " documents reviewed",
                    DOCUMENTS_PENALTY));
            score -= DOCUMENTS_PENALTY;
        }

        return new Outcome(Math.max(0.0, score), findings);
    }

    private static Optional<String> firstDebtBurdenMessage(ValidationRecord v) {
        return v.findingsOrEmpty().stream()
                .map(ValidationRecord.FindingItem::getMessage)
                .filter(m -> m != null)
                .filter(m -> {
                    String lower = m.toLowerCase(Locale.ROOT);
                    return lower.contains("debt") && lower.contains("burden");
                })
                .findFirst();
    }

    private static DecisionFinding rule(Severity severity, String message, double weight) {
        return new DecisionFinding(FindingCategory.BUSINESS_RULE, severity, message, weight);
    }
}
