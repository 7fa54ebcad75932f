package com.gymcoach.common.monitor;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gymcoach.common.risk.RiskAssessment;

import java.util.List;

/**
 * @param daysSinceLastWorkout {@code null} when no workout has been logged
 * @param overallRiskScore     weighted alert total in [0, 1]
 */
public record ProgressReport(
    @JsonProperty("alerts")               List<MonitoringAlert> alerts,
    @JsonProperty("consistencyScore")     double                consistencyScore,
    @JsonProperty("daysSinceLastWorkout") Long                  daysSinceLastWorkout,
    @JsonProperty("nutrition")            NutritionAdherence    nutrition,
    @JsonProperty("motivationScore")      double                motivationScore,
    @JsonProperty("motivationLevel")      AlertLevel            motivationLevel,
    @JsonProperty("risk")                 RiskAssessment        risk,
    @JsonProperty("overallRiskScore")     double                overallRiskScore
) {}
