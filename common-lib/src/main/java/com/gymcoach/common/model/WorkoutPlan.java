package com.gymcoach.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A planned upcoming workout. Optional input to risk assessment. When present, the
 * training-load, progression and equipment factors compare it against recent history.
 */
public record WorkoutPlan(
    @JsonProperty("name")      String                name,
    @JsonProperty("exercises") List<PlannedExercise> exercises
) {
    public List<PlannedExercise> exercisesOrEmpty() {
        return exercises == null ? List.of() : exercises;
    }

    public double plannedVolume() {
        double total = 0;
        for (PlannedExercise e : exercisesOrEmpty()) {
            total += e.weight() * e.reps() * e.sets();
        }
        return total;
    }
}
