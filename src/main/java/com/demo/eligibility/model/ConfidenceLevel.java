package com.demo.eligibility.model;

public enum ConfidenceLevel {
    LOW, MEDIUM, HIGH
}
