package com.gymcoach.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record UserProfile(
    @JsonProperty("userId")          String          userId,
    @JsonProperty("experienceLevel") ExperienceLevel experienceLevel,
    @JsonProperty("equipment")       List<String>    equipment,
    @JsonProperty("injuryHistory")   List<String>    injuryHistory,
    @JsonProperty("age")             Integer         age,
    @JsonProperty("goals")           List<String>    goals
) {
    public ExperienceLevel effectiveExperienceLevel() {
        return experienceLevel == null ? ExperienceLevel.BEGINNER : experienceLevel;
    }

    public List<String> equipmentOrEmpty() {
        return equipment == null ? List.of() : equipment;
    }

    public List<String> injuryHistoryOrEmpty() {
        return injuryHistory == null ? List.of() : injuryHistory;
    }
}
