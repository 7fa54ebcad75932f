package com.gymcoach.common.risk;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum RiskFactor {
    // injury variant
    @JsonProperty("training_load")    TRAINING_LOAD,
    @JsonProperty("movement_pattern") MOVEMENT_PATTERN,
    @JsonProperty("fatigue")          FATIGUE,
    @JsonProperty("muscle_imbalance") IMBALANCE,
    @JsonProperty("progression")      PROGRESSION,
    @JsonProperty("equipment")        EQUIPMENT,
    @JsonProperty("injury_history")   INJURY_HISTORY,
    @JsonProperty("age_fitness")      AGE_FITNESS,

    // monitoring variant
    @JsonProperty("frequency_intensity") FREQUENCY_INTENSITY,
    @JsonProperty("volume_spike")        VOLUME_SPIKE,
    @JsonProperty("age")                 AGE
}
