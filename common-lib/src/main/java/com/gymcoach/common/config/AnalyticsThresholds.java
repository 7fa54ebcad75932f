package com.gymcoach.common.config;

/**
 * Every cut-point the analyzers use, injected at construction time.
 *
 * <p>{@link #defaults()} reproduces the production calibration. The Spring layer binds
 * overrides from {@code analytics.*} properties and converts them into this immutable form.
 */
public record AnalyticsThresholds(
    Trend      trend,
    Anomaly    anomaly,
    Plateau    plateau,
    Risk       risk,
    Adaptation adaptation,
    Monitoring monitoring
) {

    public static AnalyticsThresholds defaults() {
        return new AnalyticsThresholds(
            Trend.defaults(), Anomaly.defaults(), Plateau.defaults(),
            Risk.defaults(), Adaptation.defaults(), Monitoring.defaults());
    }

    /**
     * @param minExercisePoints   dated records an exercise needs for a strength trend
     * @param strengthPct         per-exercise ±% band for improving/declining
     * @param overallStrengthPct  ±% band applied to the mean of per-exercise totals
     * @param minSessions         sessions needed for volume, intensity and consistency trends
     * @param comparisonWindow    sessions averaged at each end for volume/intensity
     * @param volumePct           ±% band for the volume trend
     * @param intensityPoints     ± percentage-point band for the intensity trend
     * @param consistencyImproving score at or above which consistency is improving
     * @param consistencyDeclining score below which consistency is declining
     * @param bodyWeightPct       ±% band for the body-composition trend
     */
    public record Trend(
        int    minExercisePoints,
        double strengthPct,
        double overallStrengthPct,
        int    minSessions,
        int    comparisonWindow,
        double volumePct,
        double intensityPoints,
        double consistencyImproving,
        double consistencyDeclining,
        double bodyWeightPct
    ) {
        public static Trend defaults() {
            return new Trend(3, 5.0, 3.0, 5, 3, 10.0, 5.0, 0.7, 0.4, 2.0);
        }
    }

    public record Anomaly(
        int    minPoints,
        double mediumSigma,
        double highSigma,
        int    progressionMinPoints,
        double fastProgressionWeeklyPct,
        double decliningProgressionWeeklyPct
    ) {
        public static Anomaly defaults() {
            return new Anomaly(5, 2.0, 3.0, 5, 10.0, -5.0);
        }
    }

    public record Plateau(
        int    minSessions,
        double maxTotalPct,
        double maxWeeklyPct,
        double minDurationWeeks
    ) {
        public static Plateau defaults() {
            return new Plateau(5, 2.0, 0.5, 2.0);
        }
    }

    /**
     * Factor weights and level cut-points for both risk variants.
     *
     * <p>The default weights add up to 1.10. With {@code normalizeWeights} the weighted sum is
     * divided by the weight total so the composite stays on the same [0, 1] scale as
     * the cut-points; without it the raw sum is used and capped at 1.
     */
    public record Risk(
        Weights weights,
        boolean normalizeWeights,
        double  injuryHigh,
        double  injuryMedium,
        double  monitoringHigh,
        double  monitoringMedium,
        double  fatigueVolumeRatio,
        double  fatigueScoreFloor
    ) {
        public static Risk defaults() {
            return new Risk(Weights.defaults(), true, 0.7, 0.4, 0.6, 0.3, 0.8, 0.7);
        }
    }

    public record Weights(
        double trainingLoad,
        double movementPattern,
        double fatigue,
        double imbalance,
        double progression,
        double equipment,
        double injuryHistory,
        double ageFitness
    ) {
        public static Weights defaults() {
            return new Weights(0.25, 0.20, 0.20, 0.15, 0.10, 0.05, 0.15, 0.10);
        }

        public double sum() {
            return trainingLoad + movementPattern + fatigue + imbalance
                + progression + equipment + injuryHistory + ageFitness;
        }
    }

    public record Adaptation(
        double plateauIntensityDelta,
        double declineIntensityDelta,
        double declineVolumeDelta,
        double overloadIntensityDelta,
        double overloadVolumeDelta,
        double overloadMinConsistency,
        double recoveryVolumeDelta,
        double simplifyMaxConsistency,
        double simplifyVolumeDelta
    ) {
        public static Adaptation defaults() {
            return new Adaptation(0.10, -0.15, -0.20, 0.05, 0.10, 0.7, -0.25, 0.4, -0.30);
        }
    }

    public record Monitoring(
        double consistencyHigh,
        double consistencyMedium,
        int    maxDaysSinceWorkout,
        double nutritionHigh,
        double nutritionMedium,
        int    inactivityDays,
        int    minNutritionDays
    ) {
        public static Monitoring defaults() {
            return new Monitoring(0.3, 0.6, 3, 0.5, 0.7, 7, 7);
        }
    }
}
