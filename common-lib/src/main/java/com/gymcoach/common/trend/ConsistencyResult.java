package com.gymcoach.common.trend;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record ConsistencyResult(
    @JsonProperty("score")                 double               score,
    @JsonProperty("averageGapDays")        double               averageGapDays,
    @JsonProperty("gapStdDevDays")         double               gapStdDevDays,
    @JsonProperty("workoutsPerWeek")       double               workoutsPerWeek,
    @JsonProperty("dayOfWeekDistribution") Map<String, Integer> dayOfWeekDistribution,
    @JsonProperty("direction")             TrendDirection       direction
) {}
