package com.gymcoach.common.trend;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One metric's trend verdict. {@code magnitude} is a percentage for strength, volume and
 * body composition, percentage points for intensity, and the raw score for consistency.
 */
public record TrendResult(
    @JsonProperty("metric")      String         metric,
    @JsonProperty("direction")   TrendDirection direction,
    @JsonProperty("magnitude")   double         magnitude,
    @JsonProperty("sampleCount") int            sampleCount
) {
    public static final String STRENGTH         = "strength";
    public static final String VOLUME           = "volume";
    public static final String INTENSITY        = "intensity";
    public static final String CONSISTENCY      = "consistency";
    public static final String BODY_COMPOSITION = "body_composition";

    public static TrendResult insufficient(String metric, int sampleCount) {
        return new TrendResult(metric, TrendDirection.INSUFFICIENT_DATA, 0.0, sampleCount);
    }

    @JsonIgnore
    public boolean hasData() {
        return direction != TrendDirection.INSUFFICIENT_DATA;
    }
}
