package com.gymcoach.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PlannedExercise(
    @JsonProperty("name")      String name,
    @JsonProperty("weight")    double weight,
    @JsonProperty("reps")      int    reps,
    @JsonProperty("sets")      int    sets,
    @JsonProperty("equipment") String equipment
) {
    public static final String BODYWEIGHT = "bodyweight";

    public String effectiveEquipment() {
        return equipment == null || equipment.isBlank() ? BODYWEIGHT : equipment;
    }
}
