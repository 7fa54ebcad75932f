package com.gymcoach.common.anomaly;

import com.gymcoach.common.config.AnalyticsThresholds;
import com.gymcoach.common.history.DatedSession;
import com.gymcoach.common.history.TrainingHistory;
import com.gymcoach.common.metrics.MetricPrimitives;
import com.gymcoach.common.result.Result;
import com.gymcoach.common.trend.StrengthProgression;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Flags outliers in a user's training history.
 *
 * <h3>Statistical channels</h3>
 * <p>Session volume, session intensity and day-gap between sessions. Each channel needs at
 * least {@code minPoints} values. With channel mean μ and sample standard deviation σ, a value
 * is {@code high} when {@code |v − μ| > highSigma·σ} and {@code medium} when it exceeds
 * {@code mediumSigma·σ}. A zero-variance channel flags nothing.
 *
 * <h3>Progression channel</h3>
 * <p>Fixed bands on weekly 1RM improvement for exercises with enough records: too fast
 * ({@code medium}, likely mis-recorded) or a real decline ({@code high}).
 *
 * <h3>Aggregate severity</h3>
 * <pre>
 *   none          → 0
 *   any high      → 0.8 + 0.1 × highCount
 *   otherwise     → 0.3 + 0.1 × mediumCount          (both capped at 1.0)
 * </pre>
 */
public final class AnomalyDetector {

    private final AnalyticsThresholds.Anomaly thresholds;
    private final AnalyticsThresholds.Trend trendThresholds;

    public AnomalyDetector(AnalyticsThresholds thresholds) {
        this.thresholds = thresholds.anomaly();
        this.trendThresholds = thresholds.trend();
    }

    public Result<AnomalyReport> detect(TrainingHistory history) {
        List<AnomalyRecord> anomalies = new ArrayList<>();
        List<AnomalyType> evaluated = new ArrayList<>();
        List<DatedSession> sessions = history.sessions();

        // ── Volume ─────────────────────────────────────────────────
        List<Double> volumes = new ArrayList<>();
        List<String> volumeRefs = new ArrayList<>();
        for (DatedSession s : sessions) {
            volumes.add(s.volume());
            volumeRefs.add(isoDate(s.date()));
        }
        sigmaChannel(AnomalyType.VOLUME, volumes, volumeRefs, anomalies, evaluated);

        // ── Intensity ──────────────────────────────────────────────
        List<Double> intensities = new ArrayList<>();
        List<String> intensityRefs = new ArrayList<>();
        for (DatedSession s : sessions) {
            OptionalDouble mean = s.meanIntensity();
            if (mean.isPresent()) {
                intensities.add(mean.getAsDouble());
                intensityRefs.add(isoDate(s.date()));
            }
        }
        sigmaChannel(AnomalyType.INTENSITY, intensities, intensityRefs, anomalies, evaluated);

        // ── Consistency gaps ───────────────────────────────────────
        List<Double> gaps = history.sessionGaps();
        List<String> gapRefs = new ArrayList<>();
        for (int i = 1; i < sessions.size(); i++) gapRefs.add(isoDate(sessions.get(i).date()));
        sigmaChannel(AnomalyType.CONSISTENCY, gaps, gapRefs, anomalies, evaluated);

        // ── Progression ────────────────────────────────────────────
        progressionChannel(history, anomalies, evaluated);

        if (evaluated.isEmpty()) {
            return Result.insufficient("fewer than " + thresholds.minPoints() + " data points in every channel");
        }

        int high = (int) anomalies.stream().filter(a -> a.severity() == Severity.HIGH).count();
        int medium = anomalies.size() - high;
        return Result.ok(new AnomalyReport(anomalies, evaluated, overallSeverity(high, medium), high, medium),
            history.warnings());
    }

    public static double overallSeverity(int highCount, int mediumCount) {
        if (highCount == 0 && mediumCount == 0) return 0.0;
        if (highCount > 0) return Math.min(1.0, 0.8 + 0.1 * highCount);
        return Math.min(1.0, 0.3 + 0.1 * mediumCount);
    }

    private void sigmaChannel(AnomalyType type, List<Double> values, List<String> refs,
                              List<AnomalyRecord> out, List<AnomalyType> evaluated) {
        if (values.size() < thresholds.minPoints()) return;
        evaluated.add(type);

        double mean = MetricPrimitives.mean(values);
        double sigma = MetricPrimitives.sampleStdDev(values);
        if (sigma == 0) return;

        AnomalyRecord.ExpectedRange range = new AnomalyRecord.ExpectedRange(
            mean - thresholds.mediumSigma() * sigma, mean + thresholds.mediumSigma() * sigma);
        for (int i = 0; i < values.size(); i++) {
            double deviation = Math.abs(values.get(i) - mean);
            Severity severity = null;
            if (deviation > thresholds.highSigma() * sigma) severity = Severity.HIGH;
            else if (deviation > thresholds.mediumSigma() * sigma) severity = Severity.MEDIUM;
            if (severity != null) {
                out.add(new AnomalyRecord(type, severity, values.get(i), range, i, refs.get(i)));
            }
        }
    }

    private void progressionChannel(TrainingHistory history, List<AnomalyRecord> out, List<AnomalyType> evaluated) {
        AnomalyRecord.ExpectedRange range = new AnomalyRecord.ExpectedRange(
            thresholds.decliningProgressionWeeklyPct(), thresholds.fastProgressionWeeklyPct());
        boolean any = false;
        for (var entry : history.loadedExercisesByName().entrySet()) {
            if (entry.getValue().size() < thresholds.progressionMinPoints()) continue;
            any = true;
            StrengthProgression p = StrengthProgression.of(entry.getKey(), entry.getValue(),
                thresholds.progressionMinPoints(), trendThresholds.strengthPct());
            double weekly = p.weeklyImprovementPct();
            if (weekly > thresholds.fastProgressionWeeklyPct()) {
                out.add(new AnomalyRecord(AnomalyType.PROGRESSION, Severity.MEDIUM, weekly, range, null, entry.getKey()));
            } else if (weekly < thresholds.decliningProgressionWeeklyPct()) {
                out.add(new AnomalyRecord(AnomalyType.PROGRESSION, Severity.HIGH, weekly, range, null, entry.getKey()));
            }
        }
        if (any) evaluated.add(AnomalyType.PROGRESSION);
    }

    private static String isoDate(LocalDateTime date) {
        return date.toLocalDate().format(DateTimeFormatter.ISO_LOCAL_DATE);
    }
}
