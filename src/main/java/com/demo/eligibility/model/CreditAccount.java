package com.demo.eligibility.model;

import java.util.Locale;
import java.util.Set;

public record CreditAccount(
        String accountType,
        String institution,
        double balance,
        Double creditLimit,
        Double monthlyPayment,
        String paymentStatus
) {
    private static final Set<String> DELINQUENT_MARKERS = Set.of(
            "delinquent", "default", "overdue", "past due", "written off", "charged off", "missed", "late");

    public boolean isDelinquent() {
        if (paymentStatus == null) return false;
        String s = paymentStatus.toLowerCase(Locale.ROOT);
        return DELINQUENT_MARKERS.stream().anyMatch(s::contains);
    }
}
