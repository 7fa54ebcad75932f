package com.gymcoach.common.trend;

import com.gymcoach.common.config.AnalyticsThresholds;
import com.gymcoach.common.history.TrainingHistory;
import com.gymcoach.common.model.GoalDirection;
import com.gymcoach.common.model.WorkoutSession;
import com.gymcoach.common.result.Result;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.gymcoach.common.TrainingFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class TrendAnalyzerTest {

    private final TrendAnalyzer analyzer = new TrendAnalyzer(AnalyticsThresholds.defaults());

    private TrendReport analyze(TrainingHistory history, GoalDirection goal) {
        Result<TrendReport> result = analyzer.analyze(history, goal);
        assertTrue(result.isOk(), "expected ok but was " + result);
        return result.toOptional().orElseThrow();
    }

    private TrendReport analyze(List<WorkoutSession> sessions) {
        return analyze(TrainingHistory.of(sessions), GoalDirection.LOSE_WEIGHT);
    }

    // ── strength ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("strength trend")
    class Strength {

        @Test
        @DisplayName("+10% 1RM over three sessions → improving")
        void improving() {
            TrendReport report = analyze(progression("Squat", 7, 5, 3, 100, 105, 110));

            StrengthProgression squat = report.strengthByExercise().get(0);
            assertEquals(TrendDirection.IMPROVING, squat.direction());
            assertEquals(10.0, squat.totalImprovementPct(), 1e-9);
            assertEquals(5.0, squat.weeklyImprovementPct(), 1e-9);
            assertEquals(TrendDirection.IMPROVING, report.overallStrength().direction());
        }

        @Test
        @DisplayName("−10% → declining")
        void declining() {
            TrendReport report = analyze(progression("Squat", 7, 5, 3, 100, 95, 90));
            assertEquals(TrendDirection.DECLINING, report.overallStrength().direction());
        }

        @Test
        @DisplayName("fewer than 3 points → exercise insufficient and excluded from overall")
        void tooFewPoints() {
            TrendReport report = analyze(progression("Squat", 7, 5, 3, 100, 140));

            assertEquals(TrendDirection.INSUFFICIENT_DATA, report.strengthByExercise().get(0).direction());
            assertEquals(TrendDirection.INSUFFICIENT_DATA, report.overallStrength().direction());
            assertFalse(report.overallStrength().hasData());
        }

        @Test
        @DisplayName("overall trend is the mean of qualifying exercises' totals")
        void overallMean() {
            List<WorkoutSession> sessions = sessions(3, 7, i -> List.of(
                ex("Squat", 100 + 10 * i, 5, 3),     // +20%
                ex("Bench", 100 - 5 * i, 5, 3),      // −10%
                ex("Row", 60, 5, 3)));               // 0%
            TrendReport report = analyze(sessions);

            assertEquals(10.0 / 3, report.overallStrength().magnitude(), 1e-9);
            assertEquals(3, report.overallStrength().sampleCount());
            assertEquals(TrendDirection.IMPROVING, report.overallStrength().direction());
        }

        @Test
        @DisplayName("bodyweight entries (weight 0) do not contribute to 1RM aggregates")
        void bodyweightExcluded() {
            TrendReport report = analyze(sessions(5, 2, i -> List.of(ex("Push-up", 0, 20, 3))));
            assertTrue(report.strengthByExercise().isEmpty());
            assertEquals(TrendDirection.INSUFFICIENT_DATA, report.overallStrength().direction());
        }
    }

    // ── volume / intensity ────────────────────────────────────────────────

    @Nested
    @DisplayName("volume and intensity trends")
    class VolumeIntensity {

        @Test
        @DisplayName("constant weight×reps×sets over ≥5 sessions → stable, magnitude 0")
        void constantVolume() {
            TrendReport report = analyze(progression("Squat", 2, 5, 3, 100, 100, 100, 100, 100, 100));

            assertEquals(TrendDirection.STABLE, report.volume().direction());
            assertEquals(0.0, report.volume().magnitude(), 1e-9);
            assertEquals(6, report.volume().sampleCount());
        }

        @Test
        @DisplayName("recent-3 vs earliest-3 volume up 20% → improving")
        void volumeUp() {
            // earliest three: 1000 each, recent three: 1200 each
            List<WorkoutSession> sessions = sessions(6, 2, i -> List.of(ex("Squat", i < 3 ? 100 : 120, 10, 1)));
            TrendReport report = analyze(sessions);

            assertEquals(TrendDirection.IMPROVING, report.volume().direction());
            assertEquals(20.0, report.volume().magnitude(), 1e-9);
        }

        @Test
        @DisplayName("4 sessions → volume and intensity insufficient")
        void tooFewSessions() {
            TrendReport report = analyze(progression("Squat", 2, 5, 3, 100, 100, 100, 100));
            assertEquals(TrendDirection.INSUFFICIENT_DATA, report.volume().direction());
            assertEquals(TrendDirection.INSUFFICIENT_DATA, report.intensity().direction());
        }

        @Test
        @DisplayName("moving from 12-rep to 3-rep sets raises intensity in percentage points")
        void intensityUp() {
            List<WorkoutSession> sessions = sessions(6, 2, i -> List.of(ex("Squat", 100, i < 3 ? 12 : 3, 3)));
            TrendReport report = analyze(sessions);

            // 100/(1+3/30) − 100/(1+12/30) ≈ 90.91 − 71.43
            assertEquals(19.48, report.intensity().magnitude(), 0.01);
            assertEquals(TrendDirection.IMPROVING, report.intensity().direction());
        }

        @Test
        @DisplayName("intensity distribution buckets loaded records by band")
        void distribution() {
            TrendReport report = analyze(List.of(session(START,
                ex("A", 100, 15, 1),   // 66.7 → moderate
                ex("B", 100, 8, 1),    // 78.9 → moderate
                ex("C", 100, 3, 1),    // 90.9 → high
                ex("D", 100, 25, 1)))); // 54.5 → low

            assertEquals(new IntensityDistribution(1, 2, 1), report.intensityDistribution());
        }
    }

    // ── consistency ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("consistency trend")
    class ConsistencyTrend {

        @Test
        @DisplayName("a session every 3 days → score 1.0, improving")
        void regular() {
            TrendReport report = analyze(progression("Squat", 3, 5, 3, 100, 100, 100, 100, 100, 100, 100, 100, 100, 100));

            assertEquals(TrendDirection.IMPROVING, report.consistency().direction());
            assertEquals(1.0, report.consistencyScore(), 1e-9);
            assertEquals(3.0, report.consistencyDetail().averageGapDays(), 1e-9);
            int total = report.consistencyDetail().dayOfWeekDistribution().values().stream().mapToInt(i -> i).sum();
            assertEquals(10, total);
        }

        @Test
        @DisplayName("erratic gaps → declining")
        void erratic() {
            List<WorkoutSession> sessions = new ArrayList<>();
            int[] offsets = {0, 1, 2, 3, 33, 34};
            for (int offset : offsets) sessions.add(session(START.plusDays(offset), ex("Squat", 100, 5, 3)));

            TrendReport report = analyze(sessions);
            assertEquals(TrendDirection.DECLINING, report.consistency().direction());
        }

        @Test
        @DisplayName("fewer than 5 sessions → insufficient and no detail")
        void insufficient() {
            TrendReport report = analyze(progression("Squat", 3, 5, 3, 100, 100, 100));
            assertEquals(TrendDirection.INSUFFICIENT_DATA, report.consistency().direction());
            assertNull(report.consistencyScore());
        }
    }

    // ── body composition ──────────────────────────────────────────────────

    @Nested
    @DisplayName("body composition trend")
    class BodyComposition {

        private TrendResult body(GoalDirection goal, double... kilos) {
            return analyze(TrainingHistory.of(List.of(), weights(kilos), List.of()), goal).bodyComposition();
        }

        @Test
        @DisplayName("−5% with a weight-loss goal → improving")
        void lossGoal() {
            TrendResult trend = body(GoalDirection.LOSE_WEIGHT, 80, 78, 76);
            assertEquals(TrendDirection.IMPROVING, trend.direction());
            assertEquals(-5.0, trend.magnitude(), 1e-9);
        }

        @Test
        @DisplayName("the same drop with a mass-gain goal → declining")
        void gainGoal() {
            assertEquals(TrendDirection.DECLINING, body(GoalDirection.GAIN_WEIGHT, 80, 78, 76).direction());
        }

        @Test
        @DisplayName("maintenance: inside ±2% is stable, outside is declining")
        void maintainGoal() {
            assertEquals(TrendDirection.STABLE, body(GoalDirection.MAINTAIN, 80, 79.5).direction());
            assertEquals(TrendDirection.DECLINING, body(GoalDirection.MAINTAIN, 80, 84).direction());
        }

        @Test
        @DisplayName("single measurement → insufficient, other trends still produced")
        void partial() {
            TrendReport report = analyze(TrainingHistory.of(
                progression("Squat", 7, 5, 3, 100, 105, 110), weights(80), List.of()), GoalDirection.LOSE_WEIGHT);

            assertEquals(TrendDirection.INSUFFICIENT_DATA, report.bodyComposition().direction());
            assertEquals(TrendDirection.IMPROVING, report.overallStrength().direction());
        }
    }

    // ── result states ─────────────────────────────────────────────────────

    @Test
    @DisplayName("no sessions and no measurements → InsufficientData result")
    void emptyHistory() {
        assertInstanceOf(Result.InsufficientData.class, analyzer.analyze(TrainingHistory.empty(), GoalDirection.LOSE_WEIGHT));
    }

    @Test
    @DisplayName("skipped records surface as warnings on the ok result")
    void warnings() {
        List<WorkoutSession> sessions = new ArrayList<>(progression("Squat", 7, 5, 3, 100, 105, 110));
        sessions.add(WorkoutSession.of("garbage", List.of()));

        Result<TrendReport> result = analyzer.analyze(TrainingHistory.of(sessions), GoalDirection.LOSE_WEIGHT);
        Result.Ok<TrendReport> ok = assertInstanceOf(Result.Ok.class, result);
        assertEquals(1, ok.warnings().size());
    }

    @Test
    @DisplayName("determinism: 100 runs over the same input are identical")
    void deterministic() {
        TrainingHistory history = TrainingHistory.of(
            progression("Squat", 3, 5, 3, 100, 102, 101, 105, 107, 106, 110), weights(80, 79, 78), List.of());
        Result<TrendReport> first = analyzer.analyze(history, GoalDirection.LOSE_WEIGHT);
        for (int i = 0; i < 100; i++) {
            assertEquals(first, analyzer.analyze(history, GoalDirection.LOSE_WEIGHT));
        }
    }
}
