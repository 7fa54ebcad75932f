package com.gymcoach.common.monitor;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum AlertLevel {
    @JsonProperty("low")    LOW(0.2),
    @JsonProperty("medium") MEDIUM(0.5),
    @JsonProperty("high")   HIGH(1.0);

    private final double multiplier;

    AlertLevel(double multiplier) {
        this.multiplier = multiplier;
    }

    public double multiplier() {
        return multiplier;
    }
}
