package com.demo.eligibility.model;

public enum DecisionStatus {
    APPROVE, DENY, NEEDS_REVIEW
}
