package com.gymcoach.common.adaptation;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The single next-step training directive.
 *
 * <p>{@code intensityDelta} and {@code volumeDelta} are fractional offsets:
 * {@code 0.10} means +10%, {@code -0.25} means −25%. An external plan-mutation step applies them.
 */
public record AdaptationStrategy(
    @JsonProperty("primaryAction")      AdaptationAction   primaryAction,
    @JsonProperty("secondaryActions")   List<String>       secondaryActions,
    @JsonProperty("intensityDelta")     double             intensityDelta,
    @JsonProperty("volumeDelta")        double             volumeDelta,
    @JsonProperty("periodizationPhase") PeriodizationPhase periodizationPhase,
    @JsonProperty("rationale")          String             rationale
) {}
