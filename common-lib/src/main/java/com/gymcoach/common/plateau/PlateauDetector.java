package com.gymcoach.common.plateau;

import com.gymcoach.common.config.AnalyticsThresholds;
import com.gymcoach.common.history.DatedExercise;
import com.gymcoach.common.history.TrainingHistory;
import com.gymcoach.common.result.Result;
import com.gymcoach.common.trend.StrengthProgression;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Finds exercises whose estimated 1RM has stalled.
 *
 * <p>An exercise with at least {@code minSessions} loaded records is plateaued when its total
 * improvement is below {@code maxTotalPct} <em>and</em> its weekly improvement is below
 * {@code maxWeeklyPct}. Duration is reported as {@code max(minDurationWeeks, records / 3)}.
 * Exercises under the record threshold are left out, not flagged.
 */
public final class PlateauDetector {

    private final AnalyticsThresholds.Plateau thresholds;
    private final AnalyticsThresholds.Trend trendThresholds;

    public PlateauDetector(AnalyticsThresholds thresholds) {
        this.thresholds = thresholds.plateau();
        this.trendThresholds = thresholds.trend();
    }

    public Result<PlateauReport> detect(TrainingHistory history) {
        List<PlateauRecord> plateaus = new ArrayList<>();
        List<String> evaluated = new ArrayList<>();

        for (Map.Entry<String, List<DatedExercise>> entry : history.loadedExercisesByName().entrySet()) {
            int n = entry.getValue().size();
            if (n < thresholds.minSessions()) continue;
            evaluated.add(entry.getKey());

            StrengthProgression p = StrengthProgression.of(entry.getKey(), entry.getValue(),
                thresholds.minSessions(), trendThresholds.strengthPct());
            if (p.totalImprovementPct() < thresholds.maxTotalPct()
                    && p.weeklyImprovementPct() < thresholds.maxWeeklyPct()) {
                double weeks = Math.max(thresholds.minDurationWeeks(), n / 3.0);
                plateaus.add(new PlateauRecord(entry.getKey(), p.totalImprovementPct(),
                    p.weeklyImprovementPct(), weeks, n));
            }
        }

        if (evaluated.isEmpty()) {
            return Result.insufficient("no exercise has " + thresholds.minSessions() + " or more loaded records");
        }
        return Result.ok(PlateauReport.of(plateaus, evaluated), history.warnings());
    }
}
