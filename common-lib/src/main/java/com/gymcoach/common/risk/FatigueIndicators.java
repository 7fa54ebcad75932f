package com.gymcoach.common.risk;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * @param fatigueScore recent-to-earlier session volume ratio capped at 1; lower means
 *                     more output has been lost. 0.5 when there is too little history.
 */
public record FatigueIndicators(
    @JsonProperty("highFatigue")  boolean      highFatigue,
    @JsonProperty("fatigueScore") double       fatigueScore,
    @JsonProperty("indicators")   List<String> indicators
) {
    public static FatigueIndicators unknown() {
        return new FatigueIndicators(false, 0.5, List.of());
    }
}
