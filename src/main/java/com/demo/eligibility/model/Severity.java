package com.demo.eligibility.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Finding severity. Declaration order is the total order used for aggregation:
 * {@code CRITICAL} is the most severe, {@code INFO} the least.
 */
public enum Severity {
    CRITICAL(0.30),
    HIGH(0.20),
    MEDIUM(0.10),
    LOW(0.05),
    INFO(0.0);

    private final double penalty;

    Severity(double penalty) {
        this.penalty = penalty;
    }

    /** Score deduction for one finding of this severity. */
    public double penalty() { return penalty; }

    public boolean isAtLeast(Severity other) {
        return compareTo(other) <= 0;
    }

    public boolean isInformational() {
        return this == INFO;
    }

    @JsonValue
    public String code() { return name().toLowerCase(Locale.ROOT); }

    /** Lenient parse; unknown or blank values read as {@code INFO}. */
    @JsonCreator
    public static Severity fromCode(String value) {
        if (value == null || value.isBlank()) return INFO;
        String v = value.trim().toUpperCase(Locale.ROOT);
        if (v.equals("WARNING")) return MEDIUM;
        try {
            return Severity.valueOf(v);
        } catch (IllegalArgumentException e) {
            return INFO;
        }
    }
}
