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

@Component
public class AssetsChecker implements ConsistencyChecker {

    public static final double HIGH_NET_WORTH = 500_000.0;
    public static final double DEBT_BURDEN_NET_WORTH = -100_000.0;
    public static final int MAX_PROPERTIES = 5;

    @Override
    public FindingCategory category() {
        return FindingCategory.ASSETS;
    }

    @Override
    public List<ValidationFinding> check(ApplicationExtraction application) {
        List<ValidationFinding> out = new ArrayList<>();
        AssetLiabilityExtraction a = application.assetsLiabilities();
        Double netWorth = a == null ? null : a.netWorth();
        if (netWorth == null) {
            out.add(finding(Severity.MEDIUM, "missing_data", "Asset and liability data is missing or incomplete"));
            return out;
        }
        if (netWorth > HIGH_NET_WORTH) {
            out.add(finding(Severity.MEDIUM, "high_net_worth",
                    String.format("High net worth of AED %,.2f may disqualify the applicant", netWorth)));
        } else if (netWorth < DEBT_BURDEN_NET_WORTH) {
            out.add(finding(Severity.HIGH, "debt_burden",
                    String.format("High debt burden: net worth AED %,.2f", netWorth)));
        }
        if (a.properties().size() > MAX_PROPERTIES) {
            out.add(finding(Severity.LOW, "many_properties",
                    a.properties().size() + " properties declared, more than " + MAX_PROPERTIES));
        }
        return out;
    }

    private static ValidationFinding finding(Severity severity, String type, String message) {
        return ValidationFinding.builder()
                .category(FindingCategory.ASSETS)
                .severity(severity)
                .findingType(type)
                .message(message)
                .fieldsInvolved(List.of("total_assets", "total_liabilities"))
                .affectedDocuments(List.of(DocumentKind.ASSET_LIABILITY_SHEET))
                .build();
    }
}
