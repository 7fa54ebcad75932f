package com.gymcoach.common.risk;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum RiskLevel {
    @JsonProperty("low")    LOW,
    @JsonProperty("medium") MEDIUM,
    @JsonProperty("high")   HIGH;

    public static RiskLevel of(double score, double highCut, double mediumCut) {
        if (score >= highCut) return HIGH;
        if (score >= mediumCut) return MEDIUM;
        return LOW;
    }
}
