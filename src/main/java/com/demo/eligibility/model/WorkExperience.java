package com.demo.eligibility.model;

public record WorkExperience(
        String jobTitle,
        String employer,
        Integer startYear,
        Integer endYear,
        boolean current
) {}
