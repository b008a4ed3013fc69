package com.demo.eligibility.model;

public record Property(String type, String description, double estimatedValue) {}
