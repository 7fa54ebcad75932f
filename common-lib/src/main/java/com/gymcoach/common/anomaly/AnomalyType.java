package com.gymcoach.common.anomaly;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum AnomalyType {
    @JsonProperty("volume")      VOLUME,
    @JsonProperty("intensity")   INTENSITY,
    @JsonProperty("consistency") CONSISTENCY,
    @JsonProperty("progression") PROGRESSION
}
