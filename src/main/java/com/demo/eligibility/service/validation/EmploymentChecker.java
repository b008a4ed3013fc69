package com.demo.eligibility.service.validation;

import com.demo.eligibility.model.ApplicationExtraction;
import com.demo.eligibility.model.DocumentKind;
import com.demo.eligibility.model.EmploymentInfo;
import com.demo.eligibility.model.FindingCategory;
import com.demo.eligibility.model.Severity;
import com.demo.eligibility.model.ValidationFinding;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

@Component
@RequiredArgsConstructor
public class EmploymentChecker implements ConsistencyChecker {

    public static final long MINIMUM_TENURE_DAYS = 90;

    private final Clock clock;

    @Override
    public FindingCategory category() {
        return FindingCategory.EMPLOYMENT;
    }

    @Override
    public List<ValidationFinding> check(ApplicationExtraction application) {
        List<ValidationFinding> out = new ArrayList<>();
        EmploymentInfo e = application.employmentInfo();

        if (e.employer() == null || e.employer().isBlank()) {
            out.add(finding(Severity.HIGH, "missing_field", "Employer name is missing", List.of("employer")));
        }
        if (e.jobTitle() == null || e.jobTitle().isBlank()) {
            out.add(finding(Severity.MEDIUM, "missing_field", "Job title is missing", List.of("job_title")));
        }

        LocalDate start = e.startDate();
        if (start != null && e.endDate() != null && e.endDate().isBefore(start)) {
            out.add(finding(Severity.CRITICAL, "invalid_dates",
                    "Employment end date " + e.endDate() + " is before start date " + start,
                    List.of("start_date", "end_date")));
        } else if (start != null) {
            LocalDate end = e.endDate() != null ? e.endDate() : LocalDate.now(clock);
            long days = ChronoUnit.DAYS.between(start, end);
            if (days < MINIMUM_TENURE_DAYS) {
                out.add(finding(Severity.MEDIUM, "short_tenure",
                        "Employment duration of " + days + " days is under " + MINIMUM_TENURE_DAYS + " days",
                        List.of("start_date", "end_date")));
            }
        }
        return out;
    }

    private static ValidationFinding finding(Severity severity, String type, String message, List<String> fields) {
        return ValidationFinding.builder()
                .category(FindingCategory.EMPLOYMENT)
                .severity(severity)
                .findingType(type)
                .message(message)
                .fieldsInvolved(fields)
                .affectedDocuments(List.of(DocumentKind.EMPLOYMENT_LETTER))
                .build();
    }
}
