package com.demo.eligibility.service.validation;

import com.demo.eligibility.model.ApplicationExtraction;
import com.demo.eligibility.model.ApplicationFixtures;
import com.demo.eligibility.model.Loan;
import com.demo.eligibility.model.AssetLiabilityExtraction;
import com.demo.eligibility.model.Severity;
import com.demo.eligibility.model.ValidationFinding;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static com.demo.eligibility.model.ApplicationFixtures.complete;
import static com.demo.eligibility.model.ApplicationFixtures.withIncome;
import static org.assertj.core.api.Assertions.*;

@DisplayName("IncomeChecker")
class IncomeCheckerTest {

    private final IncomeChecker checker = new IncomeChecker();

    private List<ValidationFinding> check(Double salary, Double bank) {
        return checker.check(withIncome(complete(), salary, bank));
    }

    @Nested
    @DisplayName("Salary against bank deposits")
    class Reconciliation {

        @Test
        @DisplayName("Matching sources produce no finding")
        void matchingSources() {
            assertThat(check(15_000.0, 15_000.0)).isEmpty();
        }

        @Test
        @DisplayName("A 40% gap is a high income mismatch")
        void largeGapIsMismatch() {
            // Arrange / Act
            List<ValidationFinding> findings = check(15_000.0, 9_000.0);

            // Assert
            assertThat(findings).singleElement().satisfies(f -> {
                assertThat(f.severity()).isEqualTo(Severity.HIGH);
                assertThat(f.findingType()).isEqualTo("income_mismatch");
                assertThat(f.message()).contains("15,000.00").contains("9,000.00");
                assertThat(f.autoResolvable()).isFalse();
            });
        }

        @ParameterizedTest(name = "salary={0} bank={1} -> {2}")
        @CsvSource({
                "10000, 8500, MEDIUM",
                "10000, 8600, NONE",
                "10000, 7000, HIGH",
                "10000, 7100, MEDIUM",
        })
        @DisplayName("Band lower bounds are inclusive")
        void bandBoundaries(double salary, double bank, String expected) {
            List<ValidationFinding> findings = check(salary, bank);

            if (expected.equals("NONE")) {
                assertThat(findings).isEmpty();
            } else {
                assertThat(findings).extracting(ValidationFinding::severity)
                        .containsExactly(Severity.valueOf(expected));
            }
        }

        @Test
        @DisplayName("Tolerated variance is auto-resolvable with the average as resolution")
        void toleratedVarianceSuggestsAverage() {
            ValidationFinding f = check(10_000.0, 8_000.0).get(0);

            assertThat(f.autoResolvable()).isTrue();
            assertThat(f.suggestedResolution()).contains("9,000.00");
        }

        @Test
        @DisplayName("Swapping the two sources yields the same severities")
        void symmetric() {
            assertThat(check(12_000.0, 9_000.0)).extracting(ValidationFinding::severity)
                    .isEqualTo(check(9_000.0, 12_000.0).stream().map(ValidationFinding::severity).toList());
            assertThat(IncomeChecker.variance(12_000, 9_000)).isEqualTo(IncomeChecker.variance(9_000, 12_000));
        }
    }

    @Nested
    @DisplayName("Income presence and level")
    class Presence {

        @Test
        @DisplayName("No income source at all is critical")
        void noIncomeIsCritical() {
            assertThat(check(null, null)).singleElement()
                    .extracting(ValidationFinding::severity).isEqualTo(Severity.CRITICAL);
        }

        @Test
        @DisplayName("A zero salary does not count as a source")
        void zeroSalaryIgnored() {
            assertThat(check(0.0, null)).extracting(ValidationFinding::findingType).containsExactly("missing_income");
        }

        @Test
        @DisplayName("Bank income alone is enough")
        void bankOnly() {
            assertThat(check(null, 12_000.0)).isEmpty();
        }

        @Test
        @DisplayName("Income under 1,000 is only informational")
        void lowIncomeIsInfo() {
            ApplicationExtraction app = withIncome(complete(), 800.0, 800.0);
            app = ApplicationFixtures.withAssets(app, new AssetLiabilityExtraction(
                    List.of(), List.of(), 1_000.0, null, List.of(), null, 1_000.0, 0.0));

            assertThat(checker.check(app)).extracting(ValidationFinding::severity).containsExactly(Severity.INFO);
        }
    }

    @Test
    @DisplayName("Debt-to-income above 43% is flagged")
    void highDebtToIncome() {
        // Arrange
        AssetLiabilityExtraction heavy = new AssetLiabilityExtraction(List.of(), List.of(), 0.0, null,
                List.of(new Loan("Personal Loans", 200_000, 5_000.0), new Loan("Auto Loans", 40_000, 2_000.0)),
                null, 50_000.0, 240_000.0);
        ApplicationExtraction app = ApplicationFixtures.withAssets(complete(), heavy);

        // Act
        List<ValidationFinding> findings = checker.check(app);

        // Assert
        assertThat(findings).singleElement().satisfies(f -> {
            assertThat(f.findingType()).isEqualTo("high_dti");
            assertThat(f.severity()).isEqualTo(Severity.MEDIUM);
            assertThat(f.message()).contains("46.7%");
        });
    }
}
