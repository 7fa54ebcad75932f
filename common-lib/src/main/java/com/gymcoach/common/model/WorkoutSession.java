package com.gymcoach.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record WorkoutSession(
    @JsonProperty("date")            String               date,
    @JsonProperty("exercises")       List<ExerciseRecord> exercises,
    @JsonProperty("durationMinutes") Integer              durationMinutes
) {
    public static WorkoutSession of(String date, List<ExerciseRecord> exercises) {
        return new WorkoutSession(date, exercises, null);
    }
}
