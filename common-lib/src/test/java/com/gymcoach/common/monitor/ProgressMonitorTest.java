package com.gymcoach.common.monitor;

import com.gymcoach.common.config.AnalyticsThresholds;
import com.gymcoach.common.exception.AnalysisException;
import com.gymcoach.common.history.TrainingHistory;
import com.gymcoach.common.model.ExperienceLevel;
import com.gymcoach.common.model.GoalDirection;
import com.gymcoach.common.model.NutritionDay;
import com.gymcoach.common.model.UserProfile;
import com.gymcoach.common.model.WorkoutSession;
import com.gymcoach.common.plateau.PlateauDetector;
import com.gymcoach.common.risk.RiskAssessor;
import com.gymcoach.common.trend.TrendAnalyzer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static com.gymcoach.common.TrainingFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class ProgressMonitorTest {

    private final AnalyticsThresholds defaults = AnalyticsThresholds.defaults();
    private final ProgressMonitor monitor = new ProgressMonitor(defaults,
        new TrendAnalyzer(defaults), new PlateauDetector(defaults), new RiskAssessor(defaults));
    private final UserProfile user = profile(ExperienceLevel.ADVANCED);

    /** Squat every other day for 10 sessions, adding 5 kg each time. */
    private static final List<WorkoutSession> REGULAR = sessions(10, 2, i -> List.of(ex("Squat", 100 + 5 * i, 5, 3)));

    private static final LocalDateTime LAST_SESSION = START.plusDays(18).atStartOfDay();

    private static List<NutritionDay> nutrition(int days, double ratio) {
        List<NutritionDay> out = new ArrayList<>();
        for (int i = 0; i < days; i++) {
            out.add(new NutritionDay(START.plusDays(i).toString(),
                2000 * ratio, 150 * ratio, 200 * ratio, 60 * ratio, 2000, 150, 200, 60));
        }
        return out;
    }

    private ProgressReport run(TrainingHistory history, UserProfile profile, LocalDateTime asOf) {
        return monitor.monitor(profile, history, GoalDirection.LOSE_WEIGHT, asOf).toOptional().orElseThrow();
    }

    private static MonitoringAlert alert(ProgressReport report, AlertType type) {
        return report.alerts().stream().filter(a -> a.type() == type).findFirst()
            .orElseThrow(() -> new AssertionError("no " + type + " alert in " + report.alerts()));
    }

    // ── alerts ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("alerts")
    class Alerts {

        @Test
        @DisplayName("empty history → consistency high, nutrition medium, low motivation; score 0.45")
        void emptyHistory() {
            ProgressReport report = run(TrainingHistory.empty(), user, LAST_SESSION);

            assertEquals(AlertLevel.HIGH, alert(report, AlertType.CONSISTENCY).level());
            assertEquals(AlertLevel.MEDIUM, alert(report, AlertType.NUTRITION).level());
            assertEquals(AlertLevel.MEDIUM, alert(report, AlertType.MOTIVATION).level());
            assertEquals(3, report.alerts().size());
            assertNull(report.daysSinceLastWorkout());
            assertEquals(AlertLevel.LOW, report.motivationLevel());
            assertEquals(0.45, report.overallRiskScore(), 1e-9);
        }

        @Test
        @DisplayName("regular, progressing, well-fed user → no alerts, high motivation")
        void healthy() {
            TrainingHistory history = TrainingHistory.of(REGULAR, List.of(), nutrition(7, 1.0));
            ProgressReport report = run(history, user, LAST_SESSION.plusDays(1));

            assertTrue(report.alerts().isEmpty(), () -> "unexpected alerts " + report.alerts());
            assertEquals(1.0, report.consistencyScore(), 1e-9);
            assertEquals(1L, report.daysSinceLastWorkout());
            assertEquals(1.0, report.nutrition().averageAdherence(), 1e-9);
            assertEquals(AlertLevel.HIGH, report.motivationLevel());
            assertEquals(0.0, report.overallRiskScore());
        }

        @Test
        @DisplayName("more than 3 days since the last workout forces a high consistency alert")
        void inactivity() {
            TrainingHistory history = TrainingHistory.of(REGULAR, List.of(), nutrition(7, 1.0));
            ProgressReport report = run(history, user, LAST_SESSION.plusDays(10));

            MonitoringAlert consistency = alert(report, AlertType.CONSISTENCY);
            assertEquals(AlertLevel.HIGH, consistency.level());
            assertEquals("10 days since last workout", consistency.message());
        }

        @Test
        @DisplayName("intake at 40% of every goal → high nutrition alert")
        void poorNutrition() {
            TrainingHistory history = TrainingHistory.of(REGULAR, List.of(), nutrition(7, 0.4));
            ProgressReport report = run(history, user, LAST_SESSION.plusDays(1));

            assertEquals(AlertLevel.HIGH, alert(report, AlertType.NUTRITION).level());
            assertEquals(0.4, report.nutrition().averageAdherence(), 1e-9);
        }

        @Test
        @DisplayName("weight rising against a loss goal → high progress alert")
        void bodyCompositionDeclining() {
            TrainingHistory history = TrainingHistory.of(REGULAR, weights(80, 82, 84), nutrition(7, 1.0));
            ProgressReport report = run(history, user, LAST_SESSION.plusDays(1));

            assertEquals(AlertLevel.HIGH, alert(report, AlertType.PROGRESS).level());
        }

        @Test
        @DisplayName("daily heavy training, injuries and age over 50 → injury-risk alert")
        void injuryRisk() {
            UserProfile older = profile(ExperienceLevel.ADVANCED, 55, List.of("shoulder impingement"), List.of());
            TrainingHistory history = TrainingHistory.of(
                sessions(14, 1, i -> List.of(ex("Deadlift", 150, 3, 3))), List.of(), nutrition(7, 1.0));

            ProgressReport report = run(history, older, START.plusDays(14).atStartOfDay());

            assertEquals(AlertLevel.HIGH, alert(report, AlertType.INJURY_RISK).level());
            assertEquals(0.6, report.risk().overallScore(), 1e-9);
        }

        @Test
        @DisplayName("asOf and profile are required")
        void contract() {
            assertThrows(AnalysisException.class,
                () -> monitor.monitor(user, TrainingHistory.empty(), GoalDirection.LOSE_WEIGHT, null));
            assertThrows(AnalysisException.class,
                () -> monitor.monitor(null, TrainingHistory.empty(), GoalDirection.LOSE_WEIGHT, LAST_SESSION));
        }
    }

    // ── nutrition adherence ───────────────────────────────────────────────

    @Nested
    @DisplayName("NutritionAdherence")
    class Adherence {

        @Test
        @DisplayName("macro bands: ±10% → 1.0, ±20% → 0.8, beyond → 1 − |ratio − 1|")
        void macroBands() {
            assertEquals(1.0, NutritionAdherence.macroScore(95, 100), 1e-9);
            assertEquals(0.8, NutritionAdherence.macroScore(85, 100), 1e-9);
            assertEquals(0.5, NutritionAdherence.macroScore(150, 100), 1e-9);
            assertEquals(0.0, NutritionAdherence.macroScore(300, 100), 1e-9);
        }

        @Test
        @DisplayName("calorie bands are tighter: ±5% and ±10%")
        void calorieBands() {
            assertEquals(1.0, NutritionAdherence.calorieScore(2080, 2000), 1e-9);
            assertEquals(0.8, NutritionAdherence.calorieScore(2160, 2000), 1e-9);
        }

        @Test
        @DisplayName("a goal of 0 counts as fully adherent")
        void noGoal() {
            assertEquals(1.0, NutritionAdherence.macroScore(40, 0));
        }

        @Test
        @DisplayName("no days logged → average 0")
        void empty() {
            NutritionAdherence a = NutritionAdherence.of(List.of());
            assertEquals(0, a.daysLogged());
            assertEquals(0.0, a.averageAdherence());
        }
    }

    @Test
    @DisplayName("overall score sums weight × level multiplier and caps at 1")
    void overallScore() {
        List<MonitoringAlert> all = new ArrayList<>();
        for (AlertType type : AlertType.values()) all.add(new MonitoringAlert(type, AlertLevel.HIGH, "x"));
        assertEquals(1.0, ProgressMonitor.overallScore(all));
        assertEquals(0.15, ProgressMonitor.overallScore(List.of(
            new MonitoringAlert(AlertType.PLATEAU, AlertLevel.HIGH, "x"))), 1e-9);
    }
}
