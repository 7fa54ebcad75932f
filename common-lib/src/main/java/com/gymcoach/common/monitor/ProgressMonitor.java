package com.gymcoach.common.monitor;

import com.gymcoach.common.config.AnalyticsThresholds;
import com.gymcoach.common.exception.AnalysisException;
import com.gymcoach.common.history.TrainingHistory;
import com.gymcoach.common.metrics.MetricPrimitives;
import com.gymcoach.common.model.GoalDirection;
import com.gymcoach.common.model.UserProfile;
import com.gymcoach.common.plateau.PlateauDetector;
import com.gymcoach.common.plateau.PlateauReport;
import com.gymcoach.common.result.Result;
import com.gymcoach.common.risk.RiskAssessment;
import com.gymcoach.common.risk.RiskAssessor;
import com.gymcoach.common.risk.RiskLevel;
import com.gymcoach.common.trend.TrendAnalyzer;
import com.gymcoach.common.trend.TrendDirection;
import com.gymcoach.common.trend.TrendReport;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Routine check-in over a user's recent history: raises consistency, progress, nutrition,
 * plateau, injury-risk and motivation alerts and folds them into one score.
 *
 * <p>{@code asOf} is supplied by the caller and is the only notion of "now" used, so
 * the same history and {@code asOf} always produce the same report.
 */
public final class ProgressMonitor {

    private static final String COMPONENT = "ProgressMonitor";

    private final AnalyticsThresholds.Monitoring thresholds;
    private final TrendAnalyzer trendAnalyzer;
    private final PlateauDetector plateauDetector;
    private final RiskAssessor riskAssessor;

    public ProgressMonitor(AnalyticsThresholds thresholds, TrendAnalyzer trendAnalyzer,
                           PlateauDetector plateauDetector, RiskAssessor riskAssessor) {
        this.thresholds = thresholds.monitoring();
        this.trendAnalyzer = trendAnalyzer;
        this.plateauDetector = plateauDetector;
        this.riskAssessor = riskAssessor;
    }

    public Result<ProgressReport> monitor(UserProfile profile, TrainingHistory history,
                                          GoalDirection goal, LocalDateTime asOf) {
        if (profile == null) throw new AnalysisException(COMPONENT, "user profile is required");
        if (asOf == null) throw new AnalysisException(COMPONENT, "asOf is required");

        List<MonitoringAlert> alerts = new ArrayList<>();

        // ── Consistency ────────────────────────────────────────────
        double consistency = MetricPrimitives.consistencyScore(history.sessionGaps());
        Long daysSince = history.lastSessionDate()
            .map(last -> Math.max(0L, MetricPrimitives.daysBetween(last, asOf)))
            .orElse(null);
        consistencyAlert(history, consistency, daysSince).ifPresent(alerts::add);

        // ── Progress ───────────────────────────────────────────────
        Optional<TrendReport> trends = trendAnalyzer.analyze(history, goal).toOptional();
        progressAlert(trends).ifPresent(alerts::add);

        // ── Nutrition ──────────────────────────────────────────────
        NutritionAdherence nutrition = NutritionAdherence.of(history.nutrition());
        nutritionAlert(nutrition).ifPresent(alerts::add);

        // ── Plateau ────────────────────────────────────────────────
        Optional<PlateauReport> plateaus = plateauDetector.detect(history).toOptional();
        if (plateaus.map(PlateauReport::plateausDetected).orElse(false)) {
            alerts.add(new MonitoringAlert(AlertType.PLATEAU, AlertLevel.MEDIUM,
                plateaus.get().plateaus().size() + " exercise(s) have plateaued"));
        }

        // ── Injury risk ────────────────────────────────────────────
        RiskAssessment risk = riskAssessor.assessForMonitoring(profile, history).toOptional().orElse(null);
        if (risk != null && risk.level() == RiskLevel.HIGH) {
            alerts.add(new MonitoringAlert(AlertType.INJURY_RISK, AlertLevel.HIGH,
                "elevated injury risk: " + String.join("; ", risk.reasons())));
        }

        // ── Motivation ─────────────────────────────────────────────
        double motivation = motivationScore(consistency, nutrition.daysLogged(), daysSince);
        AlertLevel motivationLevel = motivation >= 0.7 ? AlertLevel.HIGH
            : motivation >= 0.4 ? AlertLevel.MEDIUM : AlertLevel.LOW;
        if (motivationLevel == AlertLevel.LOW) {
            alerts.add(new MonitoringAlert(AlertType.MOTIVATION, AlertLevel.MEDIUM, "engagement is dropping"));
        }

        ProgressReport report = new ProgressReport(List.copyOf(alerts), consistency, daysSince, nutrition,
            motivation, motivationLevel, risk, overallScore(alerts));
        return Result.ok(report, history.warnings());
    }

    private Optional<MonitoringAlert> consistencyAlert(TrainingHistory history, double score, Long daysSince) {
        if (history.sessions().isEmpty()) {
            return Optional.of(new MonitoringAlert(AlertType.CONSISTENCY, AlertLevel.HIGH, "no workouts logged"));
        }
        if (daysSince != null && daysSince > thresholds.maxDaysSinceWorkout()) {
            return Optional.of(new MonitoringAlert(AlertType.CONSISTENCY, AlertLevel.HIGH,
                daysSince + " days since last workout"));
        }
        if (score < thresholds.consistencyHigh()) {
            return Optional.of(new MonitoringAlert(AlertType.CONSISTENCY, AlertLevel.HIGH, "very irregular schedule"));
        }
        if (score < thresholds.consistencyMedium()) {
            return Optional.of(new MonitoringAlert(AlertType.CONSISTENCY, AlertLevel.MEDIUM, "irregular schedule"));
        }
        return Optional.empty();
    }

    private Optional<MonitoringAlert> progressAlert(Optional<TrendReport> trends) {
        if (trends.isEmpty()) return Optional.empty();
        TrendReport report = trends.get();
        if (report.bodyComposition().direction() == TrendDirection.DECLINING) {
            return Optional.of(new MonitoringAlert(AlertType.PROGRESS, AlertLevel.HIGH,
                "body composition moving away from goal"));
        }
        if (report.overallStrength().direction() == TrendDirection.DECLINING) {
            return Optional.of(new MonitoringAlert(AlertType.PROGRESS, AlertLevel.MEDIUM, "strength is declining"));
        }
        return Optional.empty();
    }

    private Optional<MonitoringAlert> nutritionAlert(NutritionAdherence nutrition) {
        if (nutrition.daysLogged() == 0) {
            return Optional.of(new MonitoringAlert(AlertType.NUTRITION, AlertLevel.MEDIUM, "no nutrition logged"));
        }
        if (nutrition.averageAdherence() < thresholds.nutritionHigh()) {
            return Optional.of(new MonitoringAlert(AlertType.NUTRITION, AlertLevel.HIGH, "poor nutrition adherence"));
        }
        if (nutrition.averageAdherence() < thresholds.nutritionMedium()) {
            return Optional.of(new MonitoringAlert(AlertType.NUTRITION, AlertLevel.MEDIUM, "low nutrition adherence"));
        }
        return Optional.empty();
    }

    double motivationScore(double consistency, int nutritionDays, Long daysSince) {
        double score = 0.5;
        if (consistency < 0.3) score -= 0.3;
        else if (consistency > 0.8) score += 0.2;
        if (nutritionDays < thresholds.minNutritionDays()) score -= 0.2;
        if (daysSince != null && daysSince > thresholds.inactivityDays()) score -= 0.3;
        return MetricPrimitives.clampScore(score);
    }

    static double overallScore(List<MonitoringAlert> alerts) {
        double total = 0;
        for (MonitoringAlert a : alerts) total += a.type().weight() * a.level().multiplier();
        return MetricPrimitives.clampScore(total);
    }
}
