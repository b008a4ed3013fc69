package com.demo.eligibility.service.decision;

import com.demo.eligibility.model.ApplicationFixtures;
import com.demo.eligibility.model.CategoryScores;
import com.demo.eligibility.model.ConfidenceLevel;
import com.demo.eligibility.model.DecisionResult;
import com.demo.eligibility.model.DecisionStatus;
import com.demo.eligibility.model.FindingCategory;
import com.demo.eligibility.model.Severity;
import com.demo.eligibility.service.dto.ValidationRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.demo.eligibility.service.decision.ValidationRecords.record;
import static com.demo.eligibility.service.decision.ValidationRecords.uniform;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("DecisionEngine")
class DecisionEngineTest {

    private final DecisionEngine engine = new DecisionEngine(new FeatureWeightedConfidenceScorer(),
            new BusinessRuleEvaluator(), ApplicationFixtures.CLOCK);

    @Test
    @DisplayName("A strong applicant is approved with high confidence and no appeal")
    void strongApproval() {
        // Arrange
        ValidationRecord v = record("APP-1", 0.95, 1.0, 1.0, uniform(1.0), 6);

        // Act
        DecisionResult d = engine.decide("APP-1", v);

        // Assert
        assertThat(d.finalDecision()).isEqualTo(DecisionStatus.APPROVE);
        assertThat(d.confidenceLevel()).isEqualTo(ConfidenceLevel.HIGH);
        assertThat(d.appealsEligible()).isFalse();
        assertThat(d.mlPredictionClass()).isEqualTo(1);
        assertThat(d.findings().get(0).category()).isEqualTo(FindingCategory.DECISION);
        assertThat(d.findings().get(0).message()).startsWith("Strong approval: validation 0.98");
        assertThat(d.rationale()).startsWith("Decision based on validation quality (0.95)");
        assertThat(d.timestamp()).isEqualTo(ApplicationFixtures.CLOCK.instant());
        assertThat(d.validationStatus()).isEqualTo("passed");
    }

    @Test
    @DisplayName("Unknown application goes to review with zero scores")
    void notFound() {
        DecisionResult d = engine.decide("APP-404", Map.of());

        assertThat(d.finalDecision()).isEqualTo(DecisionStatus.NEEDS_REVIEW);
        assertThat(d.rationale()).isEqualTo(DecisionEngine.NOT_FOUND_RATIONALE);
        assertThat(d.confidenceLevel()).isEqualTo(ConfidenceLevel.MEDIUM);
        assertThat(d.appealsEligible()).isFalse();
        assertThat(d.mlPredictionClass()).isEqualTo(-1);
        assertThat(d.decisionScores().combinedScore()).isZero();
    }

    @Nested
    @DisplayName("Rule order")
    @ExtendWith(MockitoExtension.class)
    class RuleOrder {

        @Mock
        private ConfidenceScorer scorer;

        private DecisionEngine stubbed;

        @BeforeEach
        void setUp() {
            stubbed = new DecisionEngine(scorer, new BusinessRuleEvaluator(), ApplicationFixtures.CLOCK);
        }

        @Test
        @DisplayName("Moderate model confidence falls through to the second approval rule")
        void secondRule() {
            when(scorer.predict(any())).thenReturn(ConfidencePrediction.of(0.68));

            DecisionResult d = stubbed.decide("A", record("A", 0.9, 1.0, 0.85, uniform(1.0), 5));

            assertThat(d.finalDecision()).isEqualTo(DecisionStatus.APPROVE);
            assertThat(d.confidenceLevel()).isEqualTo(ConfidenceLevel.HIGH);
            assertThat(d.findings().get(0).message()).startsWith("Approved:");
        }

        @Test
        @DisplayName("Rule gaps below 0.85 give a conditional approval with a follow-up")
        void conditional() {
            when(scorer.predict(any())).thenReturn(ConfidencePrediction.of(0.9));

            DecisionResult d = stubbed.decide("A", record("A", 0.8, 1.0, 0.85, uniform(1.0), 5));

            assertThat(d.finalDecision()).isEqualTo(DecisionStatus.APPROVE);
            assertThat(d.confidenceLevel()).isEqualTo(ConfidenceLevel.MEDIUM);
            assertThat(d.recommendedActions()).containsExactly(DecisionEngine.ACTION_VERIFY_EMPLOYMENT);
            assertThat(d.appealsEligible()).isFalse();
        }

        @Test
        @DisplayName("Failed business rules deny with an appeal")
        void ruleDenial() {
            when(scorer.predict(any())).thenReturn(ConfidencePrediction.of(0.9));

            DecisionResult d = stubbed.decide("A", record("A", 0.5, 0.7, 0.5, uniform(0.8), 3,
                    "High debt burden: net worth AED -150,000.00"));

            assertThat(d.finalDecision()).isEqualTo(DecisionStatus.DENY);
            assertThat(d.criticalFlags()).containsExactly(DecisionEngine.FLAG_FAILED_BUSINESS_RULES);
            assertThat(d.appealsEligible()).isTrue();
            assertThat(d.decisionScores().businessRuleScore()).isCloseTo(0.35, within(1e-9));
            assertThat(d.findings().get(0).severity()).isEqualTo(Severity.CRITICAL);
            assertThat(d.findings()).hasSize(4);
        }

        @Test
        @DisplayName("Poor quality and consistency deny for insufficient data")
        void qualityDenial() {
            when(scorer.predict(any())).thenReturn(ConfidencePrediction.of(0.3));

            DecisionResult d = stubbed.decide("A", record("A", 0.55, 0.5, 1.0,
                    new CategoryScores(1.0, 1.0, 0.0, 1.0, 1.0), 6));

            assertThat(d.finalDecision()).isEqualTo(DecisionStatus.DENY);
            assertThat(d.criticalFlags()).containsExactly(DecisionEngine.FLAG_INSUFFICIENT_DATA_QUALITY);
            assertThat(d.mlPredictionClass()).isZero();
        }

        @Test
        @DisplayName("Borderline applicants are escalated for review")
        void review() {
            when(scorer.predict(any())).thenReturn(ConfidencePrediction.of(0.55));

            DecisionResult d = stubbed.decide("A", record("A", 0.65, 0.7, 1.0, uniform(0.7), 6));

            assertThat(d.finalDecision()).isEqualTo(DecisionStatus.NEEDS_REVIEW);
            assertThat(d.appealsEligible()).isTrue();
            assertThat(d.recommendedActions()).hasSize(3)
                    .startsWith(DecisionEngine.ACTION_ESCALATE, DecisionEngine.ACTION_RULE_GAPS);
            assertThat(d.recommendedActions().get(2)).startsWith("Improve data quality metrics (current: ");
            ConfidenceLevel expected = d.decisionScores().combinedScore() >= 0.60
                    ? ConfidenceLevel.MEDIUM : ConfidenceLevel.LOW;
            assertThat(d.confidenceLevel()).isEqualTo(expected);
            verify(scorer, times(1)).predict(any());
        }
    }

    @Test
    @DisplayName("A denial always traces back to rules or data quality")
    void denialImplication() {
        for (double q = 0.0; q <= 1.0; q += 0.1) {
            for (double c = 0.0; c <= 1.0; c += 0.25) {
                for (int docs = 0; docs <= 6; docs += 3) {
                    ValidationRecord v = record("A", q, c, docs / 6.0, uniform(c), docs);
                    DecisionResult d = engine.decide("A", v);
                    if (d.finalDecision() == DecisionStatus.DENY) {
                        assertThat(d.decisionScores().businessRuleScore() < 0.60 || (q < 0.60 && c < 0.60))
                                .as("q=%s c=%s docs=%s", q, c, docs).isTrue();
                    }
                    assertThat(List.of(d.decisionScores().validationScore(), d.decisionScores().mlConfidence(),
                            d.decisionScores().businessRuleScore(), d.decisionScores().combinedScore()))
                            .allSatisfy(s -> assertThat(s).isBetween(0.0, 1.0));
                }
            }
        }
    }

    @Nested
    @DisplayName("Batch")
    class Batch {

        @Test
        @DisplayName("Decides in id order and summarizes counts and shares")
        void decideAllAndSummarize() {
            // Arrange
            Map<String, ValidationRecord> validations = new LinkedHashMap<>();
            validations.put("APP-3", record("APP-3", 0.55, 0.5, 1.0, new CategoryScores(1, 1, 0, 1, 1), 6));
            validations.put("APP-1", record("APP-1", 0.95, 1.0, 1.0, uniform(1.0), 6));
            validations.put("APP-2", record("APP-2", 0.95, 1.0, 1.0, uniform(1.0), 6));
            validations.put("APP-4", record("APP-4", 0.65, 0.7, 1.0, uniform(0.7), 6));

            // Act
            List<DecisionResult> decisions = engine.decideAll(validations);
            DecisionSummary summary = engine.summarize(decisions);

            // Assert
            assertThat(decisions).extracting(DecisionResult::applicationId)
                    .containsExactly("APP-1", "APP-2", "APP-3", "APP-4");
            assertThat(summary.totalApplications()).isEqualTo(4);
            assertThat(summary.decisions()).containsEntry("approve", 2).containsEntry("deny", 1)
                    .containsEntry("needs_review", 1);
            assertThat(summary.decisionPercentages()).containsEntry("approve", 50.0).containsEntry("deny", 25.0);
            assertThat(summary.appealsEligible()).isEqualTo(2);
            assertThat(summary.confidenceDistribution().values().stream().mapToInt(Integer::intValue).sum())
                    .isEqualTo(4);
        }

        @Test
        @DisplayName("Expected ids without a validation record are decided as not found")
        void expectedIdsWithoutRecord() {
            Map<String, ValidationRecord> validations = new LinkedHashMap<>();
            validations.put("APP-2", record("APP-2", 0.95, 1.0, 1.0, uniform(1.0), 6));

            List<DecisionResult> decisions = engine.decideAll(List.of("APP-3", "APP-1", "APP-2"), validations);

            assertThat(decisions).extracting(DecisionResult::applicationId)
                    .containsExactly("APP-1", "APP-2", "APP-3");
            assertThat(decisions).filteredOn(d -> !d.applicationId().equals("APP-2"))
                    .allSatisfy(d -> {
                        assertThat(d.finalDecision()).isEqualTo(DecisionStatus.NEEDS_REVIEW);
                        assertThat(d.rationale()).isEqualTo(DecisionEngine.NOT_FOUND_RATIONALE);
                    });
        }

        @Test
        @DisplayName("An empty batch summarizes to zeros")
        void empty() {
            DecisionSummary summary = engine.summarize(new ArrayList<>());

            assertThat(summary.totalApplications()).isZero();
            assertThat(summary.decisionPercentages()).containsEntry("approve", 0.0);
            assertThat(summary.averageScores()).containsEntry("combined_score", 0.0);
        }
    }
}
