package com.gymcoach.common.plateau;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PlateauRecord(
    @JsonProperty("exercise")             String exercise,
    @JsonProperty("totalImprovementPct")  double totalImprovementPct,
    @JsonProperty("weeklyImprovementPct") double weeklyImprovementPct,
    @JsonProperty("durationWeeks")        double durationWeeks,
    @JsonProperty("sessions")             int    sessions
) {}
