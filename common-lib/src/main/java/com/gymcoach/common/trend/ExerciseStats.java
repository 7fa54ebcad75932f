package com.gymcoach.common.trend;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ExerciseStats(
    @JsonProperty("exercise")         String exercise,
    @JsonProperty("records")          int    records,
    @JsonProperty("totalVolume")      double totalVolume,
    @JsonProperty("maxWeight")        double maxWeight,
    @JsonProperty("maxReps")          int    maxReps,
    @JsonProperty("averageIntensity") double averageIntensity
) {}
