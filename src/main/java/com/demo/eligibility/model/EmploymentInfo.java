package com.demo.eligibility.model;

import java.time.LocalDate;

public record EmploymentInfo(
        String employer,
        String jobTitle,
        LocalDate startDate,
        LocalDate endDate,
        Double monthlySalary,
        String currency
) {
    public static final EmploymentInfo EMPTY = new EmploymentInfo(null, null, null, null, null, null);

    /** Employer, title and salary. */
    public int coreFieldCount() {
        int n = 0;
        if (PersonalInfo.hasText(employer)) n++;
        if (PersonalInfo.hasText(jobTitle)) n++;
        if (monthlySalary != null && monthlySalary > 0) n++;
        return n;
    }
}
