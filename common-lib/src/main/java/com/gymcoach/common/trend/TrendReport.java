package com.gymcoach.common.trend;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Full output of {@link TrendAnalyzer}. Sections without enough data carry an
 * {@code insufficient_data} direction rather than being omitted.
 *
 * <p>{@code consistencyDetail} is {@code null} when the consistency trend is insufficient.
 */
public record TrendReport(
    @JsonProperty("overallStrength")       TrendResult               overallStrength,
    @JsonProperty("strengthByExercise")    List<StrengthProgression> strengthByExercise,
    @JsonProperty("volume")                TrendResult               volume,
    @JsonProperty("intensity")             TrendResult               intensity,
    @JsonProperty("consistency")           TrendResult               consistency,
    @JsonProperty("consistencyDetail")     ConsistencyResult         consistencyDetail,
    @JsonProperty("bodyComposition")       TrendResult               bodyComposition,
    @JsonProperty("intensityDistribution") IntensityDistribution     intensityDistribution,
    @JsonProperty("exerciseStats")         List<ExerciseStats>       exerciseStats
) {

    /** The five headline trends in a fixed order. */
    @JsonIgnore
    public List<TrendResult> trends() {
        return List.of(overallStrength, volume, intensity, consistency, bodyComposition);
    }

    /** Consistency score, or {@code null} when there were too few sessions to judge it. */
    @JsonIgnore
    public Double consistencyScore() {
        return consistencyDetail == null ? null : consistencyDetail.score();
    }
}
