package com.gymcoach.common.anomaly;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A single flagged value.
 *
 * <p>For the statistical channels {@code index} is the chronological position of the value
 * within its channel and {@code reference} the ISO date of the session it belongs to.
 * For progression anomalies {@code index} is {@code null} and {@code reference} is the
 * exercise name.
 */
public record AnomalyRecord(
    @JsonProperty("type")          AnomalyType   type,
    @JsonProperty("severity")      Severity      severity,
    @JsonProperty("observedValue") double        observedValue,
    @JsonProperty("expectedRange") ExpectedRange expectedRange,
    @JsonProperty("index")         Integer       index,
    @JsonProperty("reference")     String        reference
) {
    public record ExpectedRange(
        @JsonProperty("low")  double low,
        @JsonProperty("high") double high
    ) {}
}
