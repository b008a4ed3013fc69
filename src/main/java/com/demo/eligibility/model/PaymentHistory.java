package com.demo.eligibility.model;

public record PaymentHistory(int onTime, int late30, int late60, int late90, int missed) {

    public static final PaymentHistory NONE = new PaymentHistory(0, 0, 0, 0, 0);

    public int latePayments() {
        return late30 + late60 + late90;
    }
}
