package com.demo.eligibility.service.validation;

import com.demo.eligibility.model.ApplicationExtraction;
import com.demo.eligibility.model.ApplicationFixtures;
import com.demo.eligibility.model.PersonalInfo;
import com.demo.eligibility.model.Severity;
import com.demo.eligibility.model.ValidationFinding;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static com.demo.eligibility.model.ApplicationFixtures.complete;
import static org.assertj.core.api.Assertions.*;

@DisplayName("PersonalInfoChecker")
class PersonalInfoCheckerTest {

    private final PersonalInfoChecker checker = new PersonalInfoChecker(ApplicationFixtures.CLOCK);

    private List<ValidationFinding> check(PersonalInfo p) {
        return checker.check(complete().withPersonalInfo(p));
    }

    private static PersonalInfo bornOn(LocalDate dob) {
        PersonalInfo p = ApplicationFixtures.person();
        return new PersonalInfo(p.fullName(), p.nationalId(), dob, p.nationality(), p.maritalStatus(), p.gender());
    }

    @Test
    @DisplayName("A complete identity produces no finding")
    void cleanIdentity() {
        assertThat(checker.check(complete())).isEmpty();
    }

    @Test
    @DisplayName("Each missing core field is a high finding")
    void missingFields() {
        List<ValidationFinding> findings = check(PersonalInfo.EMPTY);

        assertThat(findings).hasSize(3)
                .allSatisfy(f -> assertThat(f.severity()).isEqualTo(Severity.HIGH))
                .extracting(f -> f.fieldsInvolved().get(0))
                .containsExactly("full_name", "national_id", "date_of_birth");
    }

    @Test
    @DisplayName("A malformed national id is a medium finding")
    void malformedId() {
        PersonalInfo p = ApplicationFixtures.person();
        PersonalInfo bad = new PersonalInfo(p.fullName(), "78419901234567", p.dateOfBirth(),
                p.nationality(), p.maritalStatus(), p.gender());

        assertThat(check(bad)).singleElement().satisfies(f -> {
            assertThat(f.findingType()).isEqualTo("invalid_format");
            assertThat(f.severity()).isEqualTo(Severity.MEDIUM);
        });
    }

    @Nested
    @DisplayName("Age")
    class Age {

        @Test
        @DisplayName("Exactly eighteen today is allowed")
        void eighteenToday() {
            assertThat(check(bornOn(LocalDate.of(2007, 6, 1)))).isEmpty();
        }

        @Test
        @DisplayName("One day short of eighteen is critical")
        void underage() {
            assertThat(check(bornOn(LocalDate.of(2007, 6, 2)))).singleElement().satisfies(f -> {
                assertThat(f.severity()).isEqualTo(Severity.CRITICAL);
                assertThat(f.message()).contains("17 years old");
            });
        }

        @Test
        @DisplayName("Over a hundred is implausible but auto-resolvable")
        void implausible() {
            assertThat(check(bornOn(LocalDate.of(1920, 1, 1)))).singleElement().satisfies(f -> {
                assertThat(f.severity()).isEqualTo(Severity.MEDIUM);
                assertThat(f.autoResolvable()).isTrue();
            });
        }
    }

    @Nested
    @DisplayName("Account holder name")
    class AccountHolder {

        @Test
        @DisplayName("Reordered and differently cased names still match")
        void reorderedName() {
            PersonalInfo p = ApplicationFixtures.person();
            PersonalInfo reordered = new PersonalInfo("HASSAN, Ahmed Ali", p.nationalId(), p.dateOfBirth(),
                    p.nationality(), p.maritalStatus(), p.gender());

            assertThat(check(reordered)).isEmpty();
        }

        @Test
        @DisplayName("A different person is a name mismatch")
        void differentPerson() {
            PersonalInfo p = ApplicationFixtures.person();
            PersonalInfo other = new PersonalInfo("Fatima Yousef", p.nationalId(), p.dateOfBirth(),
                    p.nationality(), p.maritalStatus(), p.gender());

            assertThat(check(other)).extracting(ValidationFinding::findingType).containsExactly("name_mismatch");
        }

        @Test
        @DisplayName("No comparison without a bank statement")
        void noBankStatement() {
            ApplicationExtraction app = ApplicationFixtures.withIncome(complete(), 15_000.0, null)
                    .withPersonalInfo(new PersonalInfo("Someone Else", "784-1990-1234567-1",
                            LocalDate.of(1990, 5, 15), null, null, null));

            assertThat(checker.check(app)).isEmpty();
        }
    }
}
