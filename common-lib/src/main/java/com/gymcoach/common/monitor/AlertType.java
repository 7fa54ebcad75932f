package com.gymcoach.common.monitor;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum AlertType {
    @JsonProperty("consistency") CONSISTENCY(0.30),
    @JsonProperty("progress")    PROGRESS(0.25),
    @JsonProperty("nutrition")   NUTRITION(0.20),
    @JsonProperty("plateau")     PLATEAU(0.15),
    @JsonProperty("injury_risk") INJURY_RISK(0.20),
    @JsonProperty("motivation")  MOTIVATION(0.10);

    private final double weight;

    AlertType(double weight) {
        this.weight = weight;
    }

    /** Contribution of this alert type to the overall monitoring score. */
    public double weight() {
        return weight;
    }
}
