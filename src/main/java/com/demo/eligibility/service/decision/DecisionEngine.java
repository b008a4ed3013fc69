package com.demo.eligibility.service.decision;

import com.demo.eligibility.model.ConfidenceLevel;
import com.demo.eligibility.model.DecisionFinding;
import com.demo.eligibility.model.DecisionResult;
import com.demo.eligibility.model.DecisionScore;
import com.demo.eligibility.model.DecisionStatus;
import com.demo.eligibility.model.FindingCategory;
import com.demo.eligibility.model.Severity;
import com.demo.eligibility.service.dto.DecisionResponse;
import com.demo.eligibility.service.dto.ValidationRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.ToDoubleFunction;

/**
 * Fuses validation scores, model confidence and business rules into a final decision.
 * The decision rules are checked in order and the first match wins.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DecisionEngine {

    public static final String NOT_FOUND_RATIONALE = "Application not found in validation results";
    public static final String FLAG_FAILED_BUSINESS_RULES = "FAILED_BUSINESS_RULES";
    public static final String FLAG_INSUFFICIENT_DATA_QUALITY = "INSUFFICIENT_DATA_QUALITY";

    static final String ACTION_VERIFY_EMPLOYMENT = "Verify employment letter within 30 days";
    static final String ACTION_ESCALATE = "Escalate to human reviewer for additional verification";
    static final String ACTION_RULE_GAPS = "Address business rule gaps before re-submission";

    private final ConfidenceScorer confidenceScorer;
    private final BusinessRuleEvaluator ruleEvaluator;
    private final Clock clock;

    /** Looks the application up in {@code validations}; an unknown id is sent to review. */
    public DecisionResult decide(String applicationId, Map<String, ValidationRecord> validations) {
        return decide(applicationId, validations.get(applicationId));
    }

    public DecisionResult decide(String applicationId, ValidationRecord v) {
        Instant now = clock.instant();
        if (v == null) {
            log.warn("[{}] no validation result, sending to review", applicationId);
            return new DecisionResult(applicationId, DecisionStatus.NEEDS_REVIEW, DecisionScore.ZERO, List.of(),
                    NOT_FOUND_RATIONALE, ConfidenceLevel.MEDIUM, false, List.of(), List.of(), -1, "", now);
        }

        double quality = v.getQualityScore();
        double consistency = v.getConsistencyScore();
        double validation = 0.4 * quality + 0.35 * consistency + 0.25 * v.getCompletenessScore();

        ConfidencePrediction ml = confidenceScorer.predict(v);
        BusinessRuleEvaluator.Outcome rules = ruleEvaluator.evaluate(v);
        double ruleScore = rules.score();
        double combined = 0.40 * validation + 0.35 * ml.probability() + 0.25 * ruleScore;
        DecisionScore scores = new DecisionScore(validation, ml.probability(), ruleScore, combined,
                Math.max(combined, ml.probability()));

        List<DecisionFinding> findings = new ArrayList<>(rules.findings());
        List<String> actions = new ArrayList<>();
        List<String> flags = new ArrayList<>();
        DecisionStatus decision;
        ConfidenceLevel confidence;
        boolean appeals;

        if (validation >= 0.90 && ml.probability() >= 0.70 && ruleScore >= 0.90) {
            decision = DecisionStatus.APPROVE;
            confidence = ConfidenceLevel.HIGH;
            appeals = false;
            findings.add(0, decisionFinding(Severity.INFO, fmt("Strong approval: validation %.2f + ML %.2f + rules %.2f",
                    validation, ml.probability(), ruleScore), 1.0));
        } else if (validation >= 0.85 && ml.probability() >= 0.65 && ruleScore >= 0.85) {
            decision = DecisionStatus.APPROVE;
            confidence = ConfidenceLevel.HIGH;
            appeals = false;
            findings.add(0, decisionFinding(Severity.INFO, fmt("Approved: validation %.2f + ML %.2f + rules %.2f",
                    validation, ml.probability(), ruleScore), 1.0));
        } else if (validation >= 0.80 && ruleScore >= 0.75) {
            decision = DecisionStatus.APPROVE;
            confidence = ConfidenceLevel.MEDIUM;
            appeals = false;
            findings.add(0, decisionFinding(Severity.INFO,
                    fmt("Conditional approval: validation %.2f with minor flags", validation), 1.0));
            if (ruleScore < 0.85) actions.add(ACTION_VERIFY_EMPLOYMENT);
        } else if (ruleScore < 0.60) {
            decision = DecisionStatus.DENY;
            confidence = ConfidenceLevel.HIGH;
            appeals = true;
            findings.add(0, decisionFinding(Severity.CRITICAL,
                    fmt("Business rule violations: rule score %.2f", ruleScore), 1.0));
            flags.add(FLAG_FAILED_BUSINESS_RULES);
        } else if (quality < 0.60 && consistency < 0.60) {
            decision = DecisionStatus.DENY;
            confidence = ConfidenceLevel.HIGH;
            appeals = true;
            findings.add(0, decisionFinding(Severity.CRITICAL,
                    fmt("Insufficient data quality: quality %.2f, consistency %.2f", quality, consistency), 1.0));
            flags.add(FLAG_INSUFFICIENT_DATA_QUALITY);
        } else {
            decision = DecisionStatus.NEEDS_REVIEW;
            confidence = combined >= 0.60 ? ConfidenceLevel.MEDIUM : ConfidenceLevel.LOW;
            appeals = true;
            findings.add(0, decisionFinding(Severity.INFO,
                    fmt("Manual review required: combined score %.2f (borderline)", combined), 0.5));
            actions.add(ACTION_ESCALATE);
            if (ruleScore < 0.85) actions.add(ACTION_RULE_GAPS);
            if (validation < 0.85) actions.add(fmt("Improve data quality metrics (current: %.2f)", validation));
        }

        String rationale = fmt("Decision based on validation quality (%.2f), ML confidence (%.2f), "
                        + "and business rule compliance (%.2f). Combined eligibility score: %.2f",
                quality, ml.probability(), ruleScore, combined);

        log.info("[{}] decision {} (confidence {}, combined {})", applicationId, decision, confidence,
                DecisionResponse.round4(combined));
        return new DecisionResult(applicationId, decision, scores, findings, rationale, confidence, appeals,
                actions, flags, ml.predictedClass(), v.getValidationStatus(), now);
    }

    /** Decides every application in {@code validations}, in id order. */
    public List<DecisionResult> decideAll(Map<String, ValidationRecord> validations) {
        return decideAll(validations.keySet(), validations);
    }

    /**
     * Decides every id that was expected or validated, in id order. An expected id with no
     * validation record ends up in NEEDS_REVIEW through {@link #decide(String, Map)}.
     */
    public List<DecisionResult> decideAll(Collection<String> expectedIds, Map<String, ValidationRecord> validations) {
        Set<String> ids = new TreeSet<>(expectedIds);
        ids.addAll(validations.keySet());
        return ids.stream()
                .map(id -> decide(id, validations))
                .toList();
    }

    public DecisionSummary summarize(List<DecisionResult> decisions) {
        int total = decisions.size();
        Map<String, Integer> counts = new LinkedHashMap<>();
        Map<String, Double> pct = new LinkedHashMap<>();
        for (DecisionStatus s : DecisionStatus.values()) {
            int n = (int) decisions.stream().filter(d -> d.finalDecision() == s).count();
            String key = s.name().toLowerCase(Locale.ROOT);
            counts.put(key, n);
            pct.put(key, total == 0 ? 0.0 : Math.round(n * 10000.0 / total) / 100.0);
        }
        Map<String, Integer> confidence = new LinkedHashMap<>();
        for (ConfidenceLevel level : new ConfidenceLevel[]{ConfidenceLevel.HIGH, ConfidenceLevel.MEDIUM, ConfidenceLevel.LOW}) {
            confidence.put(level.name().toLowerCase(Locale.ROOT),
                    (int) decisions.stream().filter(d -> d.confidenceLevel() == level).count());
        }
        Map<String, Double> averages = new LinkedHashMap<>();
        averages.put("validation_score", average(decisions, DecisionScore::validationScore));
        averages.put("ml_confidence", average(decisions, DecisionScore::mlConfidence));
        averages.put("combined_score", average(decisions, DecisionScore::combinedScore));
        int appeals = (int) decisions.stream().filter(DecisionResult::appealsEligible).count();
        return new DecisionSummary(total, counts, pct, confidence, averages, appeals);
    }

    private static double average(List<DecisionResult> decisions, ToDoubleFunction<DecisionScore> f) {
        double mean = decisions.stream().map(DecisionResult::decisionScores).mapToDouble(f).average().orElse(0.0);
        return DecisionResponse.round4(mean);
    }

    private static DecisionFinding decisionFinding(Severity severity, String message, double weight) {
        return new DecisionFinding(FindingCategory.DECISION, severity, message, weight);
    }

    private static String fmt(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
