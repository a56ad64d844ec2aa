package com.demo.lending.service.risk;

public record RiskVerdict(Outcome outcome, Double probability, String advice) {

    public enum Outcome { SAFE, HIGH_RISK, UNAVAILABLE }

    public static RiskVerdict unavailable() {
        return new RiskVerdict(Outcome.UNAVAILABLE, null, null);
    }

    public boolean isHighRisk() {
        return outcome == Outcome.HIGH_RISK;
    }
}
