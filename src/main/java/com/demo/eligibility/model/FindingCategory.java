package com.demo.eligibility.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum FindingCategory {
    PERSONAL_INFO, EMPLOYMENT, INCOME, ASSETS, CREDIT, BUSINESS_RULE, DECISION;

    @JsonValue
    public String code() { return name().toLowerCase(Locale.ROOT); }

    @JsonCreator
    public static FindingCategory fromCode(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return FindingCategory.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
