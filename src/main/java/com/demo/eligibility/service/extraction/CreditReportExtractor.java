package com.demo.eligibility.service.extraction;

import com.demo.eligibility.model.CreditAccount;
import com.demo.eligibility.model.CreditReportExtraction;
import com.demo.eligibility.model.DocumentKind;
import com.demo.eligibility.model.PaymentHistory;
import com.demo.eligibility.service.extraction.decode.DecodedDocument;
import com.demo.eligibility.service.extraction.decode.JsonDocumentDecoder;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class CreditReportExtractor extends AbstractFieldExtractor<CreditReportExtraction> {

    static final double JSON_CONFIDENCE = 0.98;

    public CreditReportExtractor(JsonDocumentDecoder decoder) {
        super(DocumentKind.CREDIT_REPORT, decoder);
    }

    @Override
    protected double confidence(DecodedDocument doc) {
        return doc.json() != null ? JSON_CONFIDENCE : 0.0;
    }

    @Override
    protected ParseResult<CreditReportExtraction> parse(DecodedDocument doc, List<String> warnings) {
        JsonNode root = doc.json();
        if (!root.isObject()) {
            return ParseResult.err("Credit report is not a JSON object");
        }
        Integer score = intOrNull(first(root, "credit_score", "score"));
        String rating = textOrNull(first(root, "credit_rating", "score_rating", "rating"));
        List<CreditAccount> accounts = accounts(first(root, "credit_accounts", "accounts"));
        PaymentHistory history = paymentHistory(root.path("payment_history"));
        Integer enquiries = enquiries(root);
        Double outstanding = doubleOrNull(first(root, "total_outstanding", "total_debt"));
        if (outstanding == null && !accounts.isEmpty()) {
            outstanding = accounts.stream().mapToDouble(CreditAccount::balance).sum();
        }

        if (score == null) warnings.add("Credit score not found");
        if (accounts.isEmpty()) warnings.add("No credit accounts listed");
        return ParseResult.ok(new CreditReportExtraction(score, rating, accounts, history, enquiries, outstanding));
    }

    private static List<CreditAccount> accounts(JsonNode node) {
        List<CreditAccount> out = new ArrayList<>();
        if (!node.isArray()) return out;
        for (JsonNode a : node) {
            Double balance = doubleOrNull(first(a, "balance", "outstanding_balance"));
            out.add(new CreditAccount(
                    textOrNull(first(a, "account_type", "type")),
                    textOrNull(a.path("institution")),
                    balance == null ? 0.0 : balance,
                    doubleOrNull(a.path("credit_limit")),
                    doubleOrNull(first(a, "monthly_payment", "last_payment_amount")),
                    textOrNull(first(a, "payment_status", "account_status", "status"))));
        }
        return out;
    }

    private static PaymentHistory paymentHistory(JsonNode node) {
        if (!node.isObject()) return PaymentHistory.NONE;
        return new PaymentHistory(
                node.path("on_time_payments").asInt(0),
                node.path("late_payments_30_days").asInt(0),
                node.path("late_payments_60_days").asInt(0),
                node.path("late_payments_90_days").asInt(0),
                node.path("missed_payments").asInt(0));
    }

    private static Integer enquiries(JsonNode root) {
        JsonNode e = first(root, "enquiries", "inquiries");
        if (e.isArray()) return e.size();
        Integer count = intOrNull(first(root, "enquiries_count", "recent_enquiries"));
        return count != null ? count : intOrNull(e);
    }

    private static JsonNode first(JsonNode node, String... names) {
        for (String n : names) {
            JsonNode v = node.path(n);
            if (!v.isMissingNode() && !v.isNull()) return v;
        }
        return node.path(names[0]);
    }

    private static Integer intOrNull(JsonNode n) {
        if (n.isNumber()) return n.asInt();
        Double d = n.isTextual() ? TextPatterns.parseAmount(n.asText()) : null;
        return d == null ? null : (int) Math.round(d);
    }

    private static Double doubleOrNull(JsonNode n) {
        if (n.isNumber()) return n.asDouble();
        return n.isTextual() ? TextPatterns.parseAmount(n.asText()) : null;
    }

    private static String textOrNull(JsonNode n) {
        if (n.isMissingNode() || n.isNull()) return null;
        String s = n.asText().strip();
        return s.isEmpty() ? null : s;
    }
}
