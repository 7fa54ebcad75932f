package com.gymcoach.common.anomaly;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum Severity {
    @JsonProperty("medium") MEDIUM,
    @JsonProperty("high")   HIGH
}
