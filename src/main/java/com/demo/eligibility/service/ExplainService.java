package com.demo.eligibility.service;

import com.demo.eligibility.model.DecisionFinding;
import com.demo.eligibility.model.DecisionResult;
import com.demo.eligibility.service.dto.ReasonDtos;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

@Service
public class ExplainService {

    private static final Comparator<DecisionFinding> MOST_SEVERE_FIRST =
            Comparator.comparing(DecisionFinding::severity)
                    .thenComparing(Comparator.comparingDouble(DecisionFinding::weight).reversed());

    public List<ReasonDtos.Reason> topReasons(DecisionResult decision, int topK) {
        List<ReasonDtos.Reason> out = new ArrayList<>();
        if (decision == null || decision.findings().isEmpty()) return out;

        List<DecisionFinding> ranked = decision.findings().stream().sorted(MOST_SEVERE_FIRST).toList();
        int k = Math.max(1, topK);
        int n = Math.min(k, ranked.size());
        for (int i = 0; i < n; i++) {
            DecisionFinding f = ranked.get(i);
            ReasonDtos.Reason r = new ReasonDtos.Reason();
            r.category = f.category().code();
            r.severity = f.severity().name();
            r.weight   = f.weight();

            String[] tt = mapToTitleAndText(f);
            r.title = tt[0];
            r.text  = tt[1];

            out.add(r);
        }
        return out;
    }

    private String[] mapToTitleAndText(DecisionFinding f) {
        String impact = String.format(Locale.ROOT, "(%s, weight %.2f)", f.severity().name().toLowerCase(Locale.ROOT), f.weight());
        String title;
        switch (f.category()) {
            case DECISION:
                title = "Decision outcome";
                break;
            case BUSINESS_RULE:
                title = "Business rule";
                break;
            case INCOME:
                title = "Income verification";
                break;
            case ASSETS:
                title = "Assets and liabilities";
                break;
            case CREDIT:
                title = "Credit history";
                break;
            case EMPLOYMENT:
                title = "Employment";
                break;
            case PERSONAL_INFO:
                title = "Identity";
                break;
            default:
                title = "Finding: " + f.category().code();
        }
        return new String[]{title, f.message() + " " + impact};
    }
}
