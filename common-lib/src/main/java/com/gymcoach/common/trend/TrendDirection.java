package com.gymcoach.common.trend;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum TrendDirection {
    @JsonProperty("improving")         IMPROVING,
    @JsonProperty("stable")            STABLE,
    @JsonProperty("declining")         DECLINING,
    @JsonProperty("insufficient_data") INSUFFICIENT_DATA;

    /** Floating-point noise tolerated at a band edge; 3% computed as 3.0000000000000027 is still 3%. */
    private static final double EDGE_TOLERANCE = 1e-9;

    /** Symmetric band: strictly above {@code +band} improves, strictly below {@code -band} declines. */
    public static TrendDirection classify(double value, double band) {
        if (value > band + EDGE_TOLERANCE) return IMPROVING;
        if (value < -band - EDGE_TOLERANCE) return DECLINING;
        return STABLE;
    }
}
