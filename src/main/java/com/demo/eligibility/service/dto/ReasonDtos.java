package com.demo.eligibility.service.dto;

public final class ReasonDtos {
    private ReasonDtos() {}

    public static class Reason {
        public String category;
        public String severity;
        public double weight;   // contribution of the finding to the decision
        public String title;    // short label
        public String text;     // full explanation
    }
}
