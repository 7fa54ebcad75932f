package com.gymcoach.common.plateau;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * @param evaluatedExercises exercises that had enough sessions to be judged
 */
public record PlateauReport(
    @JsonProperty("plateaus")           List<PlateauRecord> plateaus,
    @JsonProperty("evaluatedExercises") List<String>        evaluatedExercises,
    @JsonProperty("plateausDetected")   boolean             plateausDetected
) {
    public static PlateauReport of(List<PlateauRecord> plateaus, List<String> evaluatedExercises) {
        return new PlateauReport(List.copyOf(plateaus), List.copyOf(evaluatedExercises), !plateaus.isEmpty());
    }
}
