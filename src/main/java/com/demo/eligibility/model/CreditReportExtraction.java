package com.demo.eligibility.model;

import java.util.List;

/** Credit bureau data; the score uses the bureau's 0-1800 scale. */
public record CreditReportExtraction(
        Integer creditScore,
        String scoreRating,
        List<CreditAccount> accounts,
        PaymentHistory paymentHistory,
        Integer enquiriesCount,
        Double totalOutstanding
) {
    public CreditReportExtraction {
        accounts = accounts == null ? List.of() : List.copyOf(accounts);
        paymentHistory = paymentHistory == null ? PaymentHistory.NONE : paymentHistory;
    }

    public boolean hasDelinquentAccount() {
        return accounts.stream().anyMatch(CreditAccount::isDelinquent);
    }
}
