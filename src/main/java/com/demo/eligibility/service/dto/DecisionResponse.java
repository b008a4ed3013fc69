package com.demo.eligibility.service.dto;

import com.demo.eligibility.model.DecisionFinding;
import com.demo.eligibility.model.DecisionResult;
import com.demo.eligibility.model.DecisionScore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;

/** Serialized decision: enums as strings, every score rounded to four decimals. */
@Data
public class DecisionResponse {

    @JsonProperty("application_id")
    private String applicationId;

    @JsonProperty("final_decision")
    private String finalDecision;

    @JsonProperty("decision_scores")
    private Scores decisionScores;

    private List<Finding> findings;

    private String rationale;

    @JsonProperty("confidence_level")
    private String confidenceLevel;

    @JsonProperty("appeals_eligible")
    private boolean appealsEligible;

    @JsonProperty("recommended_actions")
    private List<String> recommendedActions;

    @JsonProperty("critical_flags")
    private List<String> criticalFlags;

    @JsonProperty("ml_prediction_class")
    private int mlPredictionClass;

    @JsonProperty("validation_status")
    private String validationStatus;

    private Instant timestamp;

    /** Severity-ranked explanation; filled for decisions other than APPROVE. */
    @JsonProperty("top_reasons")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private List<ReasonDtos.Reason> topReasons;

    public static DecisionResponse from(DecisionResult d) {
        DecisionResponse r = new DecisionResponse();
        r.applicationId = d.applicationId();
        r.finalDecision = d.finalDecision().name();
        r.decisionScores = Scores.from(d.decisionScores());
        r.findings = d.findings().stream().map(Finding::from).toList();
        r.rationale = d.rationale();
        r.confidenceLevel = d.confidenceLevel().name();
        r.appealsEligible = d.appealsEligible();
        r.recommendedActions = d.recommendedActions();
        r.criticalFlags = d.criticalFlags();
        r.mlPredictionClass = d.mlPredictionClass();
        r.validationStatus = d.validationStatus();
        r.timestamp = d.timestamp();
        return r;
    }

    public static double round4(double v) {
        return BigDecimal.valueOf(v).setScale(4, RoundingMode.HALF_UP).doubleValue();
    }

    @Data
    public static class Scores {
        @JsonProperty("validation_score")
        private double validationScore;
        @JsonProperty("ml_confidence")
        private double mlConfidence;
        @JsonProperty("business_rule_score")
        private double businessRuleScore;
        @JsonProperty("combined_score")
        private double combinedScore;
        @JsonProperty("approval_likelihood")
        private double approvalLikelihood;

        static Scores from(DecisionScore s) {
            Scores out = new Scores();
            out.validationScore = round4(s.validationScore());
            out.mlConfidence = round4(s.mlConfidence());
            out.businessRuleScore = round4(s.businessRuleScore());
            out.combinedScore = round4(s.combinedScore());
            out.approvalLikelihood = round4(s.approvalLikelihood());
            return out;
        }
    }

    @Data
    public static class Finding {
        private String category;
        private String severity;
        private String message;
        private double weight;

        static Finding from(DecisionFinding f) {
            Finding out = new Finding();
            out.category = f.category().code();
            out.severity = f.severity().name();
            out.message = f.message();
            out.weight = round4(f.weight());
            return out;
        }
    }
}
