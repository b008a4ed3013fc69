package com.demo.eligibility.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum VerificationStatus {
    VERIFIED, INCOMPLETE, CONFLICTED, SUSPICIOUS;

    @JsonValue
    public String code() { return name().toLowerCase(Locale.ROOT); }
}
