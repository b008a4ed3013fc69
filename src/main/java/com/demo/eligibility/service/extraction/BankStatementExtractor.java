package com.demo.eligibility.service.extraction;

import com.demo.eligibility.model.BankStatementExtraction;
import com.demo.eligibility.model.BankTransaction;
import com.demo.eligibility.model.DocumentKind;
import com.demo.eligibility.service.extraction.decode.DecodedDocument;
import com.demo.eligibility.service.extraction.decode.PdfTextDecoder;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class BankStatementExtractor extends AbstractFieldExtractor<BankStatementExtraction> {

    public static final List<String> KNOWN_BANKS = List.of(
            "Emirates NBD",
            "First Abu Dhabi Bank",
            "Abu Dhabi Commercial Bank",
            "Abu Dhabi Islamic Bank",
            "Dubai Islamic Bank",
            "Emirates Islamic Bank",
            "Mashreq Bank",
            "Commercial Bank of Dubai",
            "RAKBANK"
    );

    public static final List<String> INCOME_KEYWORDS =
            List.of("salary", "payroll", "wage", "wages", "allowance", "pension");

    /** Credits below this are never counted as salary. */
    public static final double SALARY_FLOOR = 1_000.0;

    static final double TEXT_CONFIDENCE = 0.9;
    static final double TABLE_CONFIDENCE = 0.85;

    private static final Pattern ACCOUNT_NUMBER = Pattern.compile("(?<!\\d)(\\d{15,20})(?!\\d)");
    private static final Pattern AMOUNT = Pattern.compile("-?(?:AED\\s*)?-?[\\d,]+\\.\\d{2}");
    private static final Pattern TRANSACTION_ROW = Pattern.compile(
            "^(" + TextPatterns.DATE + ")\\s+(.+?)\\s+(" + AMOUNT + ")(?:\\s+(" + AMOUNT + "))?$");
    private static final Pattern CLOSING_BALANCE = Pattern.compile(
            "(?i)(?:closing|current|ending|available)\\s+balance\\s*:?\\s*(" + AMOUNT + ")");
    private static final Pattern PERIOD_LINE = Pattern.compile("(?i)(statement\\s+)?period|from\\s+.+\\s+to\\s+");

    public BankStatementExtractor(PdfTextDecoder decoder) {
        super(DocumentKind.BANK_STATEMENT, decoder);
    }

    @Override
    protected double confidence(DecodedDocument doc) {
        if (doc.hasText()) return TEXT_CONFIDENCE;
        return doc.tableRows().isEmpty() ? 0.0 : TABLE_CONFIDENCE;
    }

    @Override
    protected ParseResult<BankStatementExtraction> parse(DecodedDocument doc, List<String> warnings) {
        List<String> lines = doc.lines();
        String text = doc.text();

        String bankName = findBank(text);
        String accountNumber = findAccountNumber(lines, text);
        String holder = TextPatterns.labelled(lines, "account holder", "account name", "customer name");

        List<BankTransaction> transactions = parseTransactions(lines);
        List<BankTransaction> salary = transactions.stream().filter(BankStatementExtractor::isSalaryDeposit).toList();

        LocalDate[] period = statementPeriod(lines, transactions);
        Double closing = closingBalance(text, transactions);

        if (bankName == null) warnings.add("Bank name not recognised");
        if (accountNumber == null) warnings.add("Account number not found");
        if (transactions.isEmpty()) warnings.add("No transactions found");
        if (bankName == null && accountNumber == null && transactions.isEmpty() && closing == null) {
            return ParseResult.err("No bank statement fields found in document");
        }
        return ParseResult.ok(BankStatementExtraction.of(bankName, accountNumber, holder,
                period[0], period[1], transactions, salary, closing));
    }

    static boolean isSalaryDeposit(BankTransaction t) {
        if (!t.isCredit() || t.amount() < SALARY_FLOOR || t.description() == null) return false;
        String d = t.description().toLowerCase(Locale.ROOT);
        return INCOME_KEYWORDS.stream().anyMatch(d::contains);
    }

    private static String findBank(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        String best = null;
        int bestAt = Integer.MAX_VALUE;
        for (String bank : KNOWN_BANKS) {
            int at = lower.indexOf(bank.toLowerCase(Locale.ROOT));
            if (at >= 0 && at < bestAt) {
                best = bank;
                bestAt = at;
            }
        }
        return best;
    }

    private static String findAccountNumber(List<String> lines, String text) {
        String labelled = TextPatterns.labelled(lines, "account number", "account no", "iban");
        if (labelled != null) {
            String digits = labelled.replaceAll("[^0-9A-Za-z]", "");
            if (!digits.isEmpty()) return digits;
        }
        Matcher m = ACCOUNT_NUMBER.matcher(text);
        return m.find() ? m.group(1) : null;
    }

    private static List<BankTransaction> parseTransactions(List<String> lines) {
        List<BankTransaction> out = new ArrayList<>();
        for (String line : lines) {
            Matcher m = TRANSACTION_ROW.matcher(line);
            if (!m.matches()) continue;
            LocalDate date = TextPatterns.parseDate(m.group(1));
            Double amount = TextPatterns.parseAmount(m.group(3));
            if (date == null || amount == null) continue;
            String description = m.group(2).strip();
            if (amount > 0 && description.toLowerCase(Locale.ROOT).contains("debit")) {
                amount = -amount;
            }
            out.add(BankTransaction.of(date, description, amount, TextPatterns.parseAmount(m.group(4))));
        }
        return out;
    }

    /**
     * A labelled period line wins; otherwise the earliest and latest dates on the statement.
     */
    private static LocalDate[] statementPeriod(List<String> lines, List<BankTransaction> transactions) {
        for (String line : lines) {
            if (!PERIOD_LINE.matcher(line).find()) continue;
            List<LocalDate> dates = TextPatterns.findDates(line);
            if (dates.size() >= 2) {
                List<LocalDate> two = new ArrayList<>(dates.subList(0, 2));
                Collections.sort(two);
                return new LocalDate[]{two.get(0), two.get(1)};
            }
        }
        if (transactions.isEmpty()) return new LocalDate[]{null, null};
        LocalDate min = transactions.get(0).date();
        LocalDate max = min;
        for (BankTransaction t : transactions) {
            if (t.date().isBefore(min)) min = t.date();
            if (t.date().isAfter(max)) max = t.date();
        }
        return new LocalDate[]{min, max};
    }

    private static Double closingBalance(String text, List<BankTransaction> transactions) {
        Matcher m = CLOSING_BALANCE.matcher(text);
        if (m.find()) return TextPatterns.parseAmount(m.group(1));
        for (int i = transactions.size() - 1; i >= 0; i--) {
            if (transactions.get(i).runningBalance() != null) return transactions.get(i).runningBalance();
        }
        return null;
    }
}
