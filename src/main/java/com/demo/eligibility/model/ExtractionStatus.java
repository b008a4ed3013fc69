package com.demo.eligibility.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ExtractionStatus {
    SUCCESS, PARTIAL, FAILED, MISSING;

    @JsonValue
    public String code() { return name().toLowerCase(Locale.ROOT); }
}
