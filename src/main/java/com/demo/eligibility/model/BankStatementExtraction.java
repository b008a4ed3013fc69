package com.demo.eligibility.model;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Fields recovered from a bank statement. Salary deposits, monthly average credit and monthly
 * income are derived from the transaction list when the record is built through {@link #of}.
 */
public record BankStatementExtraction(
        String bankName,
        String accountNumber,
        String accountHolder,
        LocalDate periodStart,
        LocalDate periodEnd,
        List<BankTransaction> transactions,
        List<BankTransaction> salaryDeposits,
        Double closingBalance,
        Double monthlyAverageCredit,
        Double monthlyIncome
) {
    public BankStatementExtraction {
        transactions = transactions == null ? List.of() : List.copyOf(transactions);
        salaryDeposits = salaryDeposits == null ? List.of() : List.copyOf(salaryDeposits);
    }

    public static BankStatementExtraction of(String bankName, String accountNumber, String accountHolder,
                                             LocalDate periodStart, LocalDate periodEnd,
                                             List<BankTransaction> transactions,
                                             List<BankTransaction> salaryDeposits,
                                             Double closingBalance) {
        int months = monthsCovered(periodStart, periodEnd);
        double credits = transactions.stream().filter(BankTransaction::isCredit)
                .mapToDouble(BankTransaction::amount).sum();
        double salary = salaryDeposits.stream().mapToDouble(BankTransaction::amount).sum();
        Double avgCredit = transactions.isEmpty() ? null : credits / months;
        Double income = salaryDeposits.isEmpty() ? null : salary / months;
        return new BankStatementExtraction(bankName, accountNumber, accountHolder, periodStart, periodEnd,
                transactions, salaryDeposits, closingBalance, avgCredit, income);
    }

    /** Whole 30-day months in the period, at least one. */
    public static int monthsCovered(LocalDate start, LocalDate end) {
        if (start == null || end == null) return 1;
        long days = ChronoUnit.DAYS.between(start, end);
        return (int) Math.max(1, days / 30);
    }
}
