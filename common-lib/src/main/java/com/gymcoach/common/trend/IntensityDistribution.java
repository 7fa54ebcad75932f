package com.gymcoach.common.trend;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Count of loaded exercise records per intensity band: low below 60%, high at 80% and above. */
public record IntensityDistribution(
    @JsonProperty("low")      int low,
    @JsonProperty("moderate") int moderate,
    @JsonProperty("high")     int high
) {}
