package com.demo.eligibility.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ValidationStatus {
    PASSED, PASSED_WITH_WARNINGS, NEEDS_REVIEW, FAILED;

    @JsonValue
    public String code() { return name().toLowerCase(Locale.ROOT); }
}
