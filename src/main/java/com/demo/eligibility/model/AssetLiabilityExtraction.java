package com.demo.eligibility.model;

import java.util.List;

public record AssetLiabilityExtraction(
        List<Property> properties,
        List<Vehicle> vehicles,
        Double savings,
        Double investments,
        List<Loan> loans,
        Double creditCardDebt,
        Double totalAssets,
        Double totalLiabilities
) {
    public AssetLiabilityExtraction {
        properties = properties == null ? List.of() : List.copyOf(properties);
        vehicles = vehicles == null ? List.of() : List.copyOf(vehicles);
        loans = loans == null ? List.of() : List.copyOf(loans);
    }

    /** {@code null} unless both totals are known. */
    public Double netWorth() {
        if (totalAssets == null || totalLiabilities == null) return null;
        return totalAssets - totalLiabilities;
    }

    public double monthlyObligations() {
        return loans.stream()
                .map(Loan::monthlyPayment)
                .filter(p -> p != null && p > 0)
                .mapToDouble(Double::doubleValue)
                .sum();
    }
}
