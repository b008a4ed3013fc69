package com.demo.eligibility.service.validation;

import com.demo.eligibility.model.ApplicationExtraction;
import com.demo.eligibility.model.AssetLiabilityExtraction;
import com.demo.eligibility.model.DocumentKind;
import com.demo.eligibility.model.FindingCategory;
import com.demo.eligibility.model.Severity;
import com.demo.eligibility.model.ValidationFinding;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Reconciles the salary stated in the employment letter with the salary credited to the
 * bank account. Both bands include their lower bound.
 */
@Component
public class IncomeChecker implements ConsistencyChecker {

    public static final double MISMATCH_VARIANCE = 0.30;
    public static final double TOLERATED_VARIANCE = 0.15;
    public static final double LOW_INCOME = 1_000.0;
    public static final double MAX_DEBT_TO_INCOME = 0.43;

    private static final List<DocumentKind> INCOME_DOCUMENTS =
            List.of(DocumentKind.EMPLOYMENT_LETTER, DocumentKind.BANK_STATEMENT);

    @Override
    public FindingCategory category() {
        return FindingCategory.INCOME;
    }

    @Override
    public List<ValidationFinding> check(ApplicationExtraction application) {
        List<ValidationFinding> out = new ArrayList<>();
        Double salary = positive(application.employmentInfo().monthlySalary());
        Double bank = positive(application.bankMonthlyIncome());

        if (salary == null && bank == null) {
            out.add(base(Severity.CRITICAL, "missing_income", "Monthly income must be provided")
                    .fieldsInvolved(List.of("monthly_salary", "monthly_income"))
                    .suggestedResolution("Verify bank statement shows income transactions")
                    .build());
            return out;
        }

        if (salary != null && bank != null) {
            double variance = variance(salary, bank);
            if (variance >= MISMATCH_VARIANCE) {
                out.add(base(Severity.HIGH, "income_mismatch", String.format(
                                "Income mismatch: employment letter AED %,.2f vs bank deposits AED %,.2f (variance %.0f%%)",
                                salary, bank, variance * 100))
                        .fieldsInvolved(List.of("monthly_salary", "monthly_income"))
                        .suggestedResolution("Request updated salary certificate or bank statement")
                        .build());
            } else if (variance >= TOLERATED_VARIANCE) {
                out.add(base(Severity.MEDIUM, "income_variance", String.format(
                                "Income variance: employment letter AED %,.2f vs bank deposits AED %,.2f (variance %.0f%%)",
                                salary, bank, variance * 100))
                        .fieldsInvolved(List.of("monthly_salary", "monthly_income"))
                        .autoResolvable(true)
                        .suggestedResolution(String.format("Use the average of the two sources: AED %,.2f", (salary + bank) / 2))
                        .build());
            }
        }

        double income = referenceIncome(salary, bank);
        if (income < LOW_INCOME) {
            out.add(base(Severity.INFO, "low_income", String.format("Unusually low monthly income: AED %,.2f", income))
                    .fieldsInvolved(List.of("monthly_income"))
                    .build());
        }

        AssetLiabilityExtraction assets = application.assetsLiabilities();
        if (assets != null && income > 0) {
            double dti = assets.monthlyObligations() / income;
            if (dti > MAX_DEBT_TO_INCOME) {
                out.add(ValidationFinding.builder()
                        .category(FindingCategory.INCOME)
                        .severity(Severity.MEDIUM)
                        .findingType("high_dti")
                        .message(String.format("High debt-to-income ratio: %.1f%% (healthy threshold: <43%%)", dti * 100))
                        .fieldsInvolved(List.of("loans", "monthly_income"))
                        .affectedDocuments(List.of(DocumentKind.ASSET_LIABILITY_SHEET, DocumentKind.BANK_STATEMENT))
                        .suggestedResolution("Consider debt consolidation or income improvement programs")
                        .build());
            }
        }
        return out;
    }

    /** {@code |a - b| / max(a, b)}; symmetric in its arguments. */
    public static double variance(double a, double b) {
        double max = Math.max(a, b);
        return max <= 0 ? 0.0 : Math.abs(a - b) / max;
    }

    /** Stated salary when there is one, otherwise the bank-derived income. */
    static double referenceIncome(Double salary, Double bank) {
        if (salary != null) return salary;
        return bank != null ? bank : 0.0;
    }

    private static Double positive(Double v) {
        return v != null && v > 0 ? v : null;
    }

    private static ValidationFinding.ValidationFindingBuilder base(Severity severity, String type, String message) {
        return ValidationFinding.builder()
                .category(FindingCategory.INCOME)
                .severity(severity)
                .findingType(type)
                .message(message)
                .affectedDocuments(INCOME_DOCUMENTS);
    }
}
