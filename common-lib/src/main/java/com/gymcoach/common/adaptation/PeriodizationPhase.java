package com.gymcoach.common.adaptation;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum PeriodizationPhase {
    @JsonProperty("accumulation")    ACCUMULATION,
    @JsonProperty("intensification") INTENSIFICATION,
    @JsonProperty("deload")          DELOAD,
    @JsonProperty("maintenance")     MAINTENANCE;

    public static PeriodizationPhase forAction(AdaptationAction action) {
        return switch (action) {
            case PROGRESSIVE_OVERLOAD -> ACCUMULATION;
            case BREAK_PLATEAU -> INTENSIFICATION;
            case RECOVERY_FOCUS -> DELOAD;
            default -> MAINTENANCE;
        };
    }
}
