package com.demo.eligibility.service.validation;

import com.demo.eligibility.model.ApplicationExtraction;
import com.demo.eligibility.model.CreditAccount;
import com.demo.eligibility.model.CreditReportExtraction;
import com.demo.eligibility.model.DocumentKind;
import com.demo.eligibility.model.FindingCategory;
import com.demo.eligibility.model.Severity;
import com.demo.eligibility.model.ValidationFinding;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class CreditChecker implements ConsistencyChecker {

    public static final int POOR_SCORE = 300;
    public static final int FAIR_SCORE = 600;

    @Override
    public FindingCategory category() {
        return FindingCategory.CREDIT;
    }

    @Override
    public List<ValidationFinding> check(ApplicationExtraction application) {
        List<ValidationFinding> out = new ArrayList<>();
        CreditReportExtraction c = application.creditReport();
        if (c == null || c.creditScore() == null) {
            out.add(finding(Severity.MEDIUM, "missing_data", "Credit report data is missing", "credit_score"));
            if (c == null) return out;
        } else if (c.creditScore() < POOR_SCORE) {
            out.add(finding(Severity.HIGH, "poor_credit", "Very low credit score: " + c.creditScore(), "credit_score"));
        } else if (c.creditScore() < FAIR_SCORE) {
            out.add(finding(Severity.MEDIUM, "fair_credit", "Below-average credit score: " + c.creditScore(), "credit_score"));
        }
        List<CreditAccount> delinquent = c.accounts().stream().filter(CreditAccount::isDelinquent).toList();
        if (!delinquent.isEmpty()) {
            out.add(finding(Severity.HIGH, "delinquent_account",
                    delinquent.size() + " delinquent credit account(s): " + delinquent.get(0).paymentStatus(),
                    "credit_accounts"));
        }
        return out;
    }

    private static ValidationFinding finding(Severity severity, String type, String message, String field) {
        return ValidationFinding.builder()
                .category(FindingCategory.CREDIT)
                .severity(severity)
                .findingType(type)
                .message(message)
                .fieldsInvolved(List.of(field))
                .affectedDocuments(List.of(DocumentKind.CREDIT_REPORT))
                .build();
    }
}
