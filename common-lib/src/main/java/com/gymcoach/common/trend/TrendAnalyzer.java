package com.gymcoach.common.trend;

import com.gymcoach.common.config.AnalyticsThresholds;
import com.gymcoach.common.history.DatedExercise;
import com.gymcoach.common.history.DatedMeasurement;
import com.gymcoach.common.history.DatedSession;
import com.gymcoach.common.history.TrainingHistory;
import com.gymcoach.common.metrics.MetricPrimitives;
import com.gymcoach.common.model.GoalDirection;
import com.gymcoach.common.result.Result;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Judges the direction of five training metrics over a user's history.
 *
 * <h3>Metrics</h3>
 * <ul>
 *   <li><strong>Strength</strong>: per exercise with at least three loaded records, first vs
 *       last estimated 1RM. The overall verdict is the mean of per-exercise totals.</li>
 *   <li><strong>Volume</strong>: mean of the most recent sessions vs mean of the earliest.</li>
 *   <li><strong>Intensity</strong>: same window comparison, in percentage points.</li>
 *   <li><strong>Consistency</strong>: {@link MetricPrimitives#consistencyScore} of session gaps.</li>
 *   <li><strong>Body composition</strong>: first vs last body weight, read against the
 *       user's {@link GoalDirection}.</li>
 * </ul>
 *
 * <p>Each metric degrades to {@code insufficient_data} independently; the report is
 * still produced. Only a history with neither sessions nor measurements yields
 * {@link Result.InsufficientData}.
 *
 * <p>No Spring. No I/O. Deterministic for a given input.
 */
public final class TrendAnalyzer {

    private final AnalyticsThresholds.Trend thresholds;

    public TrendAnalyzer(AnalyticsThresholds thresholds) {
        this.thresholds = thresholds.trend();
    }

    public Result<TrendReport> analyze(TrainingHistory history, GoalDirection goal) {
        if (history.sessions().isEmpty() && history.measurements().isEmpty()) {
            return Result.insufficient("no workout sessions or body measurements");
        }

        List<StrengthProgression> byExercise = strengthByExercise(history);
        TrendReport report = new TrendReport(
            overallStrength(byExercise),
            byExercise,
            volumeTrend(history.sessions()),
            intensityTrend(history.sessions()),
            consistencyTrend(history),
            consistencyDetail(history),
            bodyCompositionTrend(history.measurements(), goal == null ? GoalDirection.LOSE_WEIGHT : goal),
            intensityDistribution(history),
            exerciseStats(history));
        return Result.ok(report, history.warnings());
    }

    // ── Strength ───────────────────────────────────────────────────

    public List<StrengthProgression> strengthByExercise(TrainingHistory history) {
        List<StrengthProgression> out = new ArrayList<>();
        history.loadedExercisesByName().forEach((name, points) ->
            out.add(StrengthProgression.of(name, points, thresholds.minExercisePoints(), thresholds.strengthPct())));
        return out;
    }

    TrendResult overallStrength(List<StrengthProgression> byExercise) {
        List<Double> totals = byExercise.stream()
            .filter(StrengthProgression::hasData)
            .map(StrengthProgression::totalImprovementPct)
            .toList();
        if (totals.isEmpty()) {
            return TrendResult.insufficient(TrendResult.STRENGTH, 0);
        }
        double mean = MetricPrimitives.clampPercent(MetricPrimitives.mean(totals));
        return new TrendResult(TrendResult.STRENGTH,
            TrendDirection.classify(mean, thresholds.overallStrengthPct()), mean, totals.size());
    }

    // ── Volume / intensity ─────────────────────────────────────────

    TrendResult volumeTrend(List<DatedSession> sessions) {
        List<Double> volumes = sessions.stream().map(DatedSession::volume).toList();
        if (volumes.size() < thresholds.minSessions()) {
            return TrendResult.insufficient(TrendResult.VOLUME, volumes.size());
        }
        double earlier = MetricPrimitives.mean(head(volumes));
        double recent = MetricPrimitives.mean(tail(volumes));
        double change = MetricPrimitives.percentChange(earlier, recent);
        return new TrendResult(TrendResult.VOLUME,
            TrendDirection.classify(change, thresholds.volumePct()), change, volumes.size());
    }

    TrendResult intensityTrend(List<DatedSession> sessions) {
        List<Double> intensities = new ArrayList<>();
        for (DatedSession s : sessions) {
            OptionalDouble mean = s.meanIntensity();
            if (mean.isPresent()) intensities.add(mean.getAsDouble());
        }
        if (intensities.size() < thresholds.minSessions()) {
            return TrendResult.insufficient(TrendResult.INTENSITY, intensities.size());
        }
        double change = MetricPrimitives.clampPercent(
            MetricPrimitives.mean(tail(intensities)) - MetricPrimitives.mean(head(intensities)));
        return new TrendResult(TrendResult.INTENSITY,
            TrendDirection.classify(change, thresholds.intensityPoints()), change, intensities.size());
    }

    private List<Double> head(List<Double> values) {
        return values.subList(0, Math.min(thresholds.comparisonWindow(), values.size()));
    }

    private List<Double> tail(List<Double> values) {
        return values.subList(Math.max(0, values.size() - thresholds.comparisonWindow()), values.size());
    }

    // ── Consistency ────────────────────────────────────────────────

    TrendResult consistencyTrend(TrainingHistory history) {
        int n = history.sessions().size();
        if (n < thresholds.minSessions()) {
            return TrendResult.insufficient(TrendResult.CONSISTENCY, n);
        }
        double score = MetricPrimitives.consistencyScore(history.sessionGaps());
        return new TrendResult(TrendResult.CONSISTENCY, consistencyDirection(score), score, n);
    }

    ConsistencyResult consistencyDetail(TrainingHistory history) {
        List<DatedSession> sessions = history.sessions();
        if (sessions.size() < thresholds.minSessions()) return null;

        List<Double> gaps = history.sessionGaps();
        double score = MetricPrimitives.consistencyScore(gaps);
        long spanDays = MetricPrimitives.daysBetween(sessions.get(0).date(), sessions.get(sessions.size() - 1).date());
        double perWeek = sessions.size() / Math.max(spanDays / 7.0, 1.0);

        Map<String, Integer> byDay = new LinkedHashMap<>();
        for (DayOfWeek day : DayOfWeek.values()) byDay.put(day.name(), 0);
        for (DatedSession s : sessions) byDay.merge(s.date().getDayOfWeek().name(), 1, Integer::sum);

        return new ConsistencyResult(score, MetricPrimitives.mean(gaps), MetricPrimitives.sampleStdDev(gaps),
            perWeek, byDay, consistencyDirection(score));
    }

    private TrendDirection consistencyDirection(double score) {
        if (score >= thresholds.consistencyImproving()) return TrendDirection.IMPROVING;
        if (score < thresholds.consistencyDeclining()) return TrendDirection.DECLINING;
        return TrendDirection.STABLE;
    }

    // ── Body composition ───────────────────────────────────────────

    TrendResult bodyCompositionTrend(List<DatedMeasurement> measurements, GoalDirection goal) {
        List<DatedMeasurement> weighed = measurements.stream().filter(m -> m.weight() > 0).toList();
        if (weighed.size() < 2) {
            return TrendResult.insufficient(TrendResult.BODY_COMPOSITION, weighed.size());
        }
        double first = weighed.get(0).weight();
        double last = weighed.get(weighed.size() - 1).weight();
        double change = MetricPrimitives.percentChange(first, last);
        double band = thresholds.bodyWeightPct();

        TrendDirection direction = switch (goal) {
            case LOSE_WEIGHT -> TrendDirection.classify(-change, band);
            case GAIN_WEIGHT -> TrendDirection.classify(change, band);
            case MAINTAIN -> Math.abs(change) > band ? TrendDirection.DECLINING : TrendDirection.STABLE;
        };
        return new TrendResult(TrendResult.BODY_COMPOSITION, direction, change, weighed.size());
    }

    // ── Distribution & stats ───────────────────────────────────────

    IntensityDistribution intensityDistribution(TrainingHistory history) {
        int low = 0, moderate = 0, high = 0;
        for (DatedExercise e : history.allExercises()) {
            if (!e.isLoaded()) continue;
            double intensity = e.intensity();
            if (intensity < 60) low++;
            else if (intensity < 80) moderate++;
            else high++;
        }
        return new IntensityDistribution(low, moderate, high);
    }

    List<ExerciseStats> exerciseStats(TrainingHistory history) {
        List<ExerciseStats> stats = new ArrayList<>();
        history.loadedExercisesByName().forEach((name, records) -> {
            double totalVolume = 0, maxWeight = 0, intensitySum = 0;
            int maxReps = 0;
            for (DatedExercise e : records) {
                totalVolume += e.volume();
                maxWeight = Math.max(maxWeight, e.weight());
                maxReps = Math.max(maxReps, e.reps());
                intensitySum += e.intensity();
            }
            stats.add(new ExerciseStats(name, records.size(), totalVolume, maxWeight, maxReps,
                intensitySum / records.size()));
        });
        return stats;
    }
}
