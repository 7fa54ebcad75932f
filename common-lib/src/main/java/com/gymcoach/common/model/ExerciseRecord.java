package com.gymcoach.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A single logged exercise inside a {@link WorkoutSession}.
 *
 * <p>{@code date} is optional; when absent the exercise inherits the session date.
 * {@code sets} is optional and defaults to 1.
 */
public record ExerciseRecord(
    @JsonProperty("name")   String  name,
    @JsonProperty("date")   String  date,
    @JsonProperty("weight") double  weight,
    @JsonProperty("reps")   int     reps,
    @JsonProperty("sets")   Integer sets
) {
    public static ExerciseRecord of(String name, double weight, int reps, int sets) {
        return new ExerciseRecord(name, null, weight, reps, sets);
    }

    public int effectiveSets() {
        return sets == null ? 1 : sets;
    }
}
