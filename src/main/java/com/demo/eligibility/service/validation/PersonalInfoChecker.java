package com.demo.eligibility.service.validation;

import com.demo.eligibility.model.ApplicationExtraction;
import com.demo.eligibility.model.BankStatementExtraction;
import com.demo.eligibility.model.DocumentKind;
import com.demo.eligibility.model.FindingCategory;
import com.demo.eligibility.model.PersonalInfo;
import com.demo.eligibility.model.Severity;
import com.demo.eligibility.model.ValidationFinding;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.Period;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

@Component
@RequiredArgsConstructor
public class PersonalInfoChecker implements ConsistencyChecker {

    /** DDD-MMDD-SSSSSSS(S)-C; issued ids carry a 7 or 8 digit serial. */
    public static final Pattern NATIONAL_ID = Pattern.compile("^\\d{3}-\\d{4}-\\d{7,8}-\\d$");
    public static final int MINIMUM_AGE = 18;
    public static final int MAXIMUM_PLAUSIBLE_AGE = 100;
    public static final double NAME_SIMILARITY_THRESHOLD = 0.70;

    private final Clock clock;

    @Override
    public FindingCategory category() {
        return FindingCategory.PERSONAL_INFO;
    }

    @Override
    public List<ValidationFinding> check(ApplicationExtraction application) {
        List<ValidationFinding> out = new ArrayList<>();
        PersonalInfo p = application.personalInfo();

        if (isBlank(p.fullName())) out.add(missing("full_name", "Applicant full name is required"));
        if (isBlank(p.nationalId())) out.add(missing("national_id", "National id number is required"));
        if (p.dateOfBirth() == null) out.add(missing("date_of_birth", "Date of birth is required"));

        if (!isBlank(p.nationalId()) && !NATIONAL_ID.matcher(p.nationalId().strip()).matches()) {
            out.add(finding(Severity.MEDIUM, "invalid_format",
                    "National id format may be incorrect: " + p.nationalId(), "national_id")
                    .suggestedResolution("Verify the id follows the DDD-MMDD-SSSSSSSS-C format")
                    .build());
        }

        if (p.dateOfBirth() != null) {
            int age = Period.between(p.dateOfBirth(), LocalDate.now(clock)).getYears();
            if (age < MINIMUM_AGE) {
                out.add(finding(Severity.CRITICAL, "underage",
                        "Applicant is " + age + " years old, below the minimum age of " + MINIMUM_AGE, "date_of_birth")
                        .build());
            } else if (age > MAXIMUM_PLAUSIBLE_AGE) {
                out.add(finding(Severity.MEDIUM, "implausible_age", "Unusual age detected: " + age + " years", "date_of_birth")
                        .autoResolvable(true)
                        .suggestedResolution("Verify date of birth is correct")
                        .build());
            }
        }

        BankStatementExtraction bank = application.bankStatement();
        if (bank != null && !isBlank(bank.accountHolder()) && !isBlank(p.fullName())) {
            double similarity = NameSimilarity.of(p.fullName(), bank.accountHolder());
            if (similarity < NAME_SIMILARITY_THRESHOLD) {
                out.add(ValidationFinding.builder()
                        .category(FindingCategory.PERSONAL_INFO)
                        .severity(Severity.MEDIUM)
                        .findingType("name_mismatch")
                        .message(String.format("Name mismatch: '%s' vs account holder '%s' (similarity: %.0f%%)",
                                p.fullName(), bank.accountHolder(), similarity * 100))
                        .fieldsInvolved(List.of("full_name", "account_holder"))
                        .affectedDocuments(List.of(DocumentKind.IDENTITY_CARD, DocumentKind.BANK_STATEMENT))
                        .suggestedResolution("Verify applicant identity across all documents")
                        .build());
            }
        }
        return out;
    }

    private static ValidationFinding missing(String field, String message) {
        return finding(Severity.HIGH, "missing_field", message, field)
                .suggestedResolution("Ensure the identity card is readable and uploaded")
                .build();
    }

    private static ValidationFinding.ValidationFindingBuilder finding(Severity severity, String type, String message, String field) {
        return ValidationFinding.builder()
                .category(FindingCategory.PERSONAL_INFO)
                .severity(severity)
                .findingType(type)
                .message(message)
                .fieldsInvolved(List.of(field))
                .affectedDocuments(List.of(DocumentKind.IDENTITY_CARD));
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
