package com.gymcoach.analysis.config;

import com.gymcoach.common.config.AnalyticsThresholds;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Binds {@code analytics.*} from application.yml.
 *
 * <p>Field defaults mirror {@link AnalyticsThresholds#defaults()}, so an empty
 * {@code analytics} block yields the production calibration. The analyzers never see this
 * class; they receive the immutable snapshot from {@link #toThresholds()}.
 */
@Data
@ConfigurationProperties(prefix = "analytics")
public class AnalyticsProperties {

    private Trend trend = new Trend();
    private Anomaly anomaly = new Anomaly();
    private Plateau plateau = new Plateau();
    private Risk risk = new Risk();
    private Adaptation adaptation = new Adaptation();
    private Monitoring monitoring = new Monitoring();
    private Batch batch = new Batch();

    public AnalyticsThresholds toThresholds() {
        return new AnalyticsThresholds(
            new AnalyticsThresholds.Trend(
                trend.minExercisePoints, trend.strengthPct, trend.overallStrengthPct,
                trend.minSessions, trend.comparisonWindow, trend.volumePct,
                trend.intensityPoints, trend.consistencyImproving, trend.consistencyDeclining,
                trend.bodyWeightPct),
            new AnalyticsThresholds.Anomaly(
                anomaly.minPoints, anomaly.mediumSigma, anomaly.highSigma,
                anomaly.progressionMinPoints, anomaly.fastProgressionWeeklyPct,
                anomaly.decliningProgressionWeeklyPct),
            new AnalyticsThresholds.Plateau(
                plateau.minSessions, plateau.maxTotalPct, plateau.maxWeeklyPct,
                plateau.minDurationWeeks),
            new AnalyticsThresholds.Risk(
                new AnalyticsThresholds.Weights(
                    risk.weights.trainingLoad, risk.weights.movementPattern, risk.weights.fatigue,
                    risk.weights.imbalance, risk.weights.progression, risk.weights.equipment,
                    risk.weights.injuryHistory, risk.weights.ageFitness),
                risk.normalizeWeights, risk.injuryHigh, risk.injuryMedium,
                risk.monitoringHigh, risk.monitoringMedium,
                risk.fatigueVolumeRatio, risk.fatigueScoreFloor),
            new AnalyticsThresholds.Adaptation(
                adaptation.plateauIntensityDelta, adaptation.declineIntensityDelta,
                adaptation.declineVolumeDelta, adaptation.overloadIntensityDelta,
                adaptation.overloadVolumeDelta, adaptation.overloadMinConsistency,
                adaptation.recoveryVolumeDelta, adaptation.simplifyMaxConsistency,
                adaptation.simplifyVolumeDelta),
            new AnalyticsThresholds.Monitoring(
                monitoring.consistencyHigh, monitoring.consistencyMedium,
                monitoring.maxDaysSinceWorkout, monitoring.nutritionHigh,
                monitoring.nutritionMedium, monitoring.inactivityDays,
                monitoring.minNutritionDays));
    }

    @Data
    public static class Trend {
        /** Dated records an exercise needs before it gets a strength trend. */
        private int minExercisePoints = 3;
        private double strengthPct = 5.0;
        private double overallStrengthPct = 3.0;
        /** Sessions needed for the volume, intensity and consistency trends. */
        private int minSessions = 5;
        private int comparisonWindow = 3;
        private double volumePct = 10.0;
        /** Band in percentage points, not relative percent. */
        private double intensityPoints = 5.0;
        private double consistencyImproving = 0.7;
        private double consistencyDeclining = 0.4;
        private double bodyWeightPct = 2.0;
    }

    @Data
    public static class Anomaly {
        private int minPoints = 5;
        private double mediumSigma = 2.0;
        private double highSigma = 3.0;
        private int progressionMinPoints = 5;
        private double fastProgressionWeeklyPct = 10.0;
        private double decliningProgressionWeeklyPct = -5.0;
    }

    @Data
    public static class Plateau {
        private int minSessions = 5;
        private double maxTotalPct = 2.0;
        private double maxWeeklyPct = 0.5;
        private double minDurationWeeks = 2.0;
    }

    @Data
    public static class Risk {
        private Weights weights = new Weights();
        /** Divide the weighted factor sum by the weight total. */
        private boolean normalizeWeights = true;
        private double injuryHigh = 0.7;
        private double injuryMedium = 0.4;
        private double monitoringHigh = 0.6;
        private double monitoringMedium = 0.3;
        private double fatigueVolumeRatio = 0.8;
        private double fatigueScoreFloor = 0.7;
    }

    @Data
    public static class Weights {
        private double trainingLoad = 0.25;
        private double movementPattern = 0.20;
        private double fatigue = 0.20;
        private double imbalance = 0.15;
        private double progression = 0.10;
        private double equipment = 0.05;
        private double injuryHistory = 0.15;
        private double ageFitness = 0.10;
    }

    @Data
    public static class Adaptation {
        private double plateauIntensityDelta = 0.10;
        private double declineIntensityDelta = -0.15;
        private double declineVolumeDelta = -0.20;
        private double overloadIntensityDelta = 0.05;
        private double overloadVolumeDelta = 0.10;
        private double overloadMinConsistency = 0.7;
        private double recoveryVolumeDelta = -0.25;
        private double simplifyMaxConsistency = 0.4;
        private double simplifyVolumeDelta = -0.30;
    }

    @Data
    public static class Monitoring {
        private double consistencyHigh = 0.3;
        private double consistencyMedium = 0.6;
        private int maxDaysSinceWorkout = 3;
        private double nutritionHigh = 0.5;
        private double nutritionMedium = 0.7;
        private int inactivityDays = 7;
        private int minNutritionDays = 7;
    }

    @Data
    public static class Batch {
        /** Users analysed at the same time by the batch endpoint. */
        private int concurrency = 4;
        /** Per-user timeout; {@code null} disables it. A timed-out user is dropped from the batch. */
        private Duration userTimeout;
        /** History window when the caller does not name one. */
        private int windowDays = 30;
    }
}
