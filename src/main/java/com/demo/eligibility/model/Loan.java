package com.demo.eligibility.model;

public record Loan(String type, double amountRemaining, Double monthlyPayment) {}
