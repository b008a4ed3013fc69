package com.demo.eligibility.model;

public record Vehicle(String description, double estimatedValue) {}
