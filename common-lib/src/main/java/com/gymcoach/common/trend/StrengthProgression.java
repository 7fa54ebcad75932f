package com.gymcoach.common.trend;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gymcoach.common.history.DatedExercise;
import com.gymcoach.common.metrics.MetricPrimitives;

import java.util.List;

/**
 * Estimated-1RM progression of a single exercise between its first and last dated record.
 *
 * <p>Shared by the trend, anomaly, plateau and risk computations so that every one of
 * them judges the same exercise from the same numbers.
 */
public record StrengthProgression(
    @JsonProperty("exercise")             String         exercise,
    @JsonProperty("firstOneRepMax")       double         firstOneRepMax,
    @JsonProperty("lastOneRepMax")        double         lastOneRepMax,
    @JsonProperty("totalImprovementPct")  double         totalImprovementPct,
    @JsonProperty("weeklyImprovementPct") double         weeklyImprovementPct,
    @JsonProperty("dataPoints")           int            dataPoints,
    @JsonProperty("spanDays")             long           spanDays,
    @JsonProperty("direction")            TrendDirection direction
) {

    /**
     * Computes the progression from date-sorted loaded records.
     *
     * <p>{@code weekly = total / max(spanDays / 7, 1)}, or 0 when every record falls on the
     * same day. Fewer than {@code minPoints} records yields an insufficient-data entry.
     */
    public static StrengthProgression of(String exercise, List<DatedExercise> sorted,
                                         int minPoints, double directionBandPct) {
        int n = sorted.size();
        if (n < minPoints || n == 0) {
            return new StrengthProgression(exercise, 0, 0, 0, 0, n, 0, TrendDirection.INSUFFICIENT_DATA);
        }
        DatedExercise first = sorted.get(0);
        DatedExercise last = sorted.get(n - 1);
        double firstMax = first.oneRepMax();
        double lastMax = last.oneRepMax();
        long spanDays = MetricPrimitives.daysBetween(first.date(), last.date());

        double total = firstMax > 0 ? (lastMax - firstMax) / firstMax * 100 : 0.0;
        double weekly = spanDays > 0 ? total / Math.max(spanDays / 7.0, 1.0) : 0.0;

        total = MetricPrimitives.clampPercent(total);
        weekly = MetricPrimitives.clampPercent(weekly);
        return new StrengthProgression(exercise, firstMax, lastMax, total, weekly, n, spanDays,
            TrendDirection.classify(total, directionBandPct));
    }

    @JsonIgnore
    public boolean hasData() {
        return direction != TrendDirection.INSUFFICIENT_DATA;
    }
}
