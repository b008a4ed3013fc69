package com.demo.eligibility.model;

import java.time.LocalDate;

public record BankTransaction(
        LocalDate date,
        String description,
        double amount,
        Type type,
        Double runningBalance
) {
    public enum Type { CREDIT, DEBIT }

    /** The sign of {@code amount} decides the direction. */
    public static BankTransaction of(LocalDate date, String description, double amount, Double runningBalance) {
        return new BankTransaction(date, description, amount, amount >= 0 ? Type.CREDIT : Type.DEBIT, runningBalance);
    }

    public boolean isCredit() {
        return type == Type.CREDIT;
    }
}
