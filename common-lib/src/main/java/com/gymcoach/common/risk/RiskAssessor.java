package com.gymcoach.common.risk;

import com.gymcoach.common.config.AnalyticsThresholds;
import com.gymcoach.common.exception.AnalysisException;
import com.gymcoach.common.history.DatedExercise;
import com.gymcoach.common.history.DatedMeasurement;
import com.gymcoach.common.history.DatedSession;
import com.gymcoach.common.history.TrainingHistory;
import com.gymcoach.common.metrics.MetricPrimitives;
import com.gymcoach.common.model.ExperienceLevel;
import com.gymcoach.common.model.PlannedExercise;
import com.gymcoach.common.model.UserProfile;
import com.gymcoach.common.model.WorkoutPlan;
import com.gymcoach.common.result.Result;
import com.gymcoach.common.risk.MovementPatterns.MuscleGroup;
import com.gymcoach.common.risk.MovementPatterns.Pattern;

import java.time.LocalDateTime;
import java.time.temporal.IsoFields;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Composite injury-risk and fatigue scoring.
 *
 * <h3>Injury variant</h3>
 * <p>Eight independent factor scores, each a small additive rule set capped at 1.0,
 * combined as a weighted sum:
 * <pre>
 *   training load      0.25      progression     0.10
 *   movement pattern   0.20      equipment       0.05
 *   fatigue            0.20      injury history  0.15
 *   muscle imbalance   0.15      age / fitness   0.10
 * </pre>
 * The default weights total 1.10; see {@link AnalyticsThresholds.Risk} for how that is
 * reconciled. Levels: {@code high ≥ 0.7}, {@code medium ≥ 0.4}.
 *
 * <h3>Monitoring variant</h3>
 * <p>Four additive flags on the same scale, levels {@code high ≥ 0.6}, {@code medium ≥ 0.3}.
 *
 * <p>A {@code null} profile is a contract violation and raises {@link AnalysisException};
 * thin or empty history never does.
 */
public final class RiskAssessor {

    private static final String COMPONENT = "RiskAssessor";

    /** Sessions treated as the "recent" window for load and pattern rules. */
    private static final int RECENT_SESSIONS = 7;

    private static final List<String> SENSITIVE_AREAS = List.of("back", "spine", "knee", "shoulder", "neck");

    private final AnalyticsThresholds.Risk thresholds;
    private final AnalyticsThresholds.Trend trendThresholds;

    public RiskAssessor(AnalyticsThresholds thresholds) {
        this.thresholds = thresholds.risk();
        this.trendThresholds = thresholds.trend();
    }

    // ── Injury variant ─────────────────────────────────────────────

    public Result<RiskAssessment> assess(UserProfile profile, TrainingHistory history, WorkoutPlan plan) {
        requireProfile(profile);
        AnalyticsThresholds.Weights w = thresholds.weights();

        List<FactorScore> factors = List.of(
            trainingLoad(history, plan, w.trainingLoad()),
            movementPattern(history, w.movementPattern()),
            fatigue(history, w.fatigue()),
            imbalance(history, w.imbalance()),
            progression(history, plan, w.progression()),
            equipment(profile, plan, w.equipment()),
            injuryHistory(profile, w.injuryHistory()),
            ageFitness(profile, history, w.ageFitness()));

        double weighted = 0;
        for (FactorScore f : factors) weighted += f.score() * f.weight();
        double overall = thresholds.normalizeWeights() && w.sum() > 0
            ? weighted / w.sum()
            : weighted;
        overall = MetricPrimitives.clampScore(overall);

        RiskAssessment assessment = new RiskAssessment(overall,
            RiskLevel.of(overall, thresholds.injuryHigh(), thresholds.injuryMedium()),
            RiskVariant.INJURY, factors, collectReasons(factors), fatigueIndicators(history));
        return Result.ok(assessment, history.warnings());
    }

    FactorScore trainingLoad(TrainingHistory history, WorkoutPlan plan, double weight) {
        List<DatedSession> sessions = history.sessions();
        if (sessions.isEmpty()) {
            return factor(RiskFactor.TRAINING_LOAD, 0.3, weight, List.of("no training history"));
        }
        List<DatedSession> recent = recent(sessions);
        List<Double> volumes = recent.stream().map(DatedSession::volume).toList();
        double score = 0;
        List<String> reasons = new ArrayList<>();

        double increase;
        if (plan != null && !plan.exercisesOrEmpty().isEmpty()) {
            increase = MetricPrimitives.percentChange(MetricPrimitives.mean(volumes), plan.plannedVolume());
        } else {
            List<Double> weekly = new ArrayList<>(weeklyVolumes(sessions).values());
            increase = weekly.size() < 2 ? 0.0
                : MetricPrimitives.percentChange(weekly.get(weekly.size() - 2), weekly.get(weekly.size() - 1));
        }
        if (increase > 20) {
            score += 0.4;
            reasons.add("training load up " + pct(increase) + " (over 20%)");
        } else if (increase > 10) {
            score += 0.2;
            reasons.add("training load up " + pct(increase) + " (over 10%)");
        }

        double intensity = meanIntensity(recent);
        if (intensity > 85) {
            score += 0.3;
            reasons.add("very high average intensity " + pct(intensity));
        } else if (intensity > 75) {
            score += 0.1;
            reasons.add("high average intensity " + pct(intensity));
        }

        double mean = MetricPrimitives.mean(volumes);
        if (volumes.size() >= 2 && mean > 0) {
            double cv = MetricPrimitives.sampleStdDev(volumes) / mean;
            if (cv > 0.3) {
                score += 0.2;
                reasons.add("erratic session volume");
            }
        }
        return factor(RiskFactor.TRAINING_LOAD, score, weight, reasons);
    }

    /** Scores the recent sessions only; planned exercises do not count toward the balance. */
    FactorScore movementPattern(TrainingHistory history, double weight) {
        List<String> names = new ArrayList<>();
        for (DatedSession s : recent(history.sessions())) {
            for (DatedExercise e : s.exercises()) names.add(e.name());
        }

        Map<Pattern, Integer> counts = new EnumMap<>(Pattern.class);
        for (Pattern p : Pattern.values()) counts.put(p, 0);
        for (String name : names) {
            Pattern p = MovementPatterns.patternOf(name);
            if (p != null) counts.merge(p, 1, Integer::sum);
        }

        double score = 0;
        List<String> reasons = new ArrayList<>();
        int push = counts.get(Pattern.PUSH);
        int pull = counts.get(Pattern.PULL);
        if (push + pull > 0) {
            double ratio = (double) push / Math.max(pull, 1);
            if (ratio > 2 || ratio < 0.5) {
                score += 0.3;
                reasons.add("push/pull imbalance (" + push + ":" + pull + ")");
            }
        }
        int knee = counts.get(Pattern.KNEE_DOMINANT);
        int hip = counts.get(Pattern.HIP_DOMINANT);
        if ((double) knee / Math.max(hip, 1) > 2) {
            score += 0.2;
            reasons.add("knee-dominant work outweighs hip-dominant (" + knee + ":" + hip + ")");
        }

        Set<String> distinct = new LinkedHashSet<>(names);
        int totalPatterns = counts.values().stream().mapToInt(Integer::intValue).sum();
        if (distinct.size() < 5 && totalPatterns > 10) {
            score += 0.2;
            reasons.add("repetitive movement selection");
        }
        for (String name : distinct) {
            if (MovementPatterns.containsAny(name, MovementPatterns.HIGH_RISK_KEYWORDS)) {
                score += 0.1;
                reasons.add("high-skill movement: " + name);
            }
        }
        return factor(RiskFactor.MOVEMENT_PATTERN, score, weight, reasons);
    }

    FactorScore fatigue(TrainingHistory history, double weight) {
        List<DatedSession> sessions = history.sessions();
        if (sessions.size() < 5) {
            return factor(RiskFactor.FATIGUE, 0.3, weight, List.of("too little history to judge fatigue"));
        }
        List<Double> volumes = sessions.stream().map(DatedSession::volume).toList();
        int mid = volumes.size() / 2;
        double earlier = MetricPrimitives.mean(volumes.subList(0, mid));
        double recent = MetricPrimitives.mean(volumes.subList(mid, volumes.size()));
        double drop = (earlier - recent) / Math.max(earlier, 1) * 100;

        double score = 0;
        List<String> reasons = new ArrayList<>();
        if (drop > 20) {
            score += 0.5;
            reasons.add("session volume dropped " + pct(drop));
        } else if (drop > 10) {
            score += 0.3;
            reasons.add("session volume dropped " + pct(drop));
        }

        double perWeek = sessionsPerWeek(sessions);
        if (perWeek > 6) {
            score += 0.4;
            reasons.add("training more than 6 times a week");
        } else if (perWeek > 5) {
            score += 0.2;
            reasons.add("training more than 5 times a week");
        }
        return factor(RiskFactor.FATIGUE, score, weight, reasons);
    }

    FactorScore imbalance(TrainingHistory history, double weight) {
        Map<MuscleGroup, Integer> counts = new EnumMap<>(MuscleGroup.class);
        for (MuscleGroup g : MuscleGroup.values()) counts.put(g, 0);
        int total = 0;
        for (DatedExercise e : history.allExercises()) {
            MuscleGroup group = MovementPatterns.muscleGroupOf(e.name());
            if (group != null) {
                counts.merge(group, 1, Integer::sum);
                total++;
            }
        }

        double score = 0;
        List<String> reasons = new ArrayList<>();
        if (counts.get(MuscleGroup.CHEST) > counts.get(MuscleGroup.BACK) * 1.5) {
            score += 0.3;
            reasons.add("chest work exceeds back work");
        }
        if (counts.get(MuscleGroup.QUADS) > counts.get(MuscleGroup.HAMSTRINGS) * 2) {
            score += 0.3;
            reasons.add("quad work exceeds hamstring work");
        }
        if (counts.get(MuscleGroup.BICEPS) > counts.get(MuscleGroup.TRICEPS) * 1.5) {
            score += 0.2;
            reasons.add("biceps work exceeds triceps work");
        }
        if (total > 10) {
            for (MuscleGroup g : List.of(MuscleGroup.CHEST, MuscleGroup.BACK, MuscleGroup.QUADS,
                                         MuscleGroup.HAMSTRINGS, MuscleGroup.BICEPS, MuscleGroup.TRICEPS)) {
                if (counts.get(g) == 0) {
                    score += 0.1;
                    reasons.add("neglected muscle group: " + g.name().toLowerCase(Locale.ROOT));
                }
            }
        }
        return factor(RiskFactor.IMBALANCE, score, weight, reasons);
    }

    FactorScore progression(TrainingHistory history, WorkoutPlan plan, double weight) {
        double score = 0;
        List<String> reasons = new ArrayList<>();
        Map<String, List<DatedExercise>> byName = history.loadedExercisesByName();

        for (Map.Entry<String, List<DatedExercise>> entry : byName.entrySet()) {
            List<DatedExercise> points = entry.getValue();
            if (points.size() < trendThresholds.minExercisePoints()) continue;
            DatedExercise first = points.get(0);
            DatedExercise last = points.get(points.size() - 1);
            long days = MetricPrimitives.daysBetween(first.date(), last.date());
            if (days <= 0) continue;
            double total = MetricPrimitives.percentChange(first.oneRepMax(), last.oneRepMax());
            double weekly = total / (days / 7.0);
            if (weekly > 10) {
                score += 0.4;
                reasons.add("very rapid progression on " + entry.getKey() + " (" + pct(weekly) + "/week)");
            } else if (weekly > 5) {
                score += 0.2;
                reasons.add("rapid progression on " + entry.getKey() + " (" + pct(weekly) + "/week)");
            }
        }

        if (plan != null) {
            for (PlannedExercise planned : plan.exercisesOrEmpty()) {
                if (planned.name() == null || planned.weight() <= 0) continue;
                List<DatedExercise> past = byName.get(TrainingHistory.normalizeName(planned.name()));
                if (past == null || past.isEmpty()) continue;
                List<Double> lastWeights = past.subList(Math.max(0, past.size() - 3), past.size())
                    .stream().map(DatedExercise::weight).toList();
                double jump = MetricPrimitives.percentChange(MetricPrimitives.mean(lastWeights), planned.weight());
                if (jump > 15) {
                    score += 0.3;
                    reasons.add("planned weight jump on " + planned.name() + " (" + pct(jump) + ")");
                } else if (jump > 10) {
                    score += 0.1;
                    reasons.add("planned weight increase on " + planned.name() + " (" + pct(jump) + ")");
                }
            }
        }
        return factor(RiskFactor.PROGRESSION, score, weight, reasons);
    }

    FactorScore equipment(UserProfile profile, WorkoutPlan plan, double weight) {
        if (plan == null) return factor(RiskFactor.EQUIPMENT, 0, weight, List.of());

        Set<String> owned = new HashSet<>();
        for (String item : profile.equipmentOrEmpty()) {
            if (item != null) owned.add(TrainingHistory.normalizeName(item));
        }
        ExperienceLevel level = profile.effectiveExperienceLevel();

        double score = 0;
        List<String> reasons = new ArrayList<>();
        for (PlannedExercise e : plan.exercisesOrEmpty()) {
            String needed = TrainingHistory.normalizeName(e.effectiveEquipment());
            if (!PlannedExercise.BODYWEIGHT.equals(needed) && !owned.contains(needed)) {
                score += 0.2;
                reasons.add("equipment not available: " + needed);
            }
            String name = e.name() == null ? "" : TrainingHistory.normalizeName(e.name());
            if (e.weight() > 0 && MovementPatterns.containsAny(name, MovementPatterns.FREE_WEIGHT_KEYWORDS)) {
                if (level == ExperienceLevel.BEGINNER && e.weight() > 50) {
                    score += 0.3;
                    reasons.add("heavy free weight for a beginner: " + name);
                } else if (level == ExperienceLevel.INTERMEDIATE && e.weight() > 100) {
                    score += 0.2;
                    reasons.add("heavy free weight for an intermediate lifter: " + name);
                }
            }
        }
        return factor(RiskFactor.EQUIPMENT, score, weight, reasons);
    }

    FactorScore injuryHistory(UserProfile profile, double weight) {
        List<String> injuries = profile.injuryHistoryOrEmpty();
        if (injuries.isEmpty()) return factor(RiskFactor.INJURY_HISTORY, 0, weight, List.of());

        double score = 0.4;
        List<String> reasons = new ArrayList<>();
        reasons.add("previous injuries on record");
        for (String injury : injuries) {
            if (injury == null) continue;
            String text = injury.toLowerCase(Locale.ROOT);
            if (MovementPatterns.containsAny(text, SENSITIVE_AREAS)) {
                score += 0.2;
                reasons.add("sensitive injury site: " + injury);
            }
        }
        return factor(RiskFactor.INJURY_HISTORY, score, weight, reasons);
    }

    FactorScore ageFitness(UserProfile profile, TrainingHistory history, double weight) {
        double score = 0;
        List<String> reasons = new ArrayList<>();
        Integer age = profile.age();
        if (age != null && age > 50) {
            score += 0.2;
            reasons.add("age over 50");
        } else if (age != null && age > 40) {
            score += 0.1;
            reasons.add("age over 40");
        }

        switch (profile.effectiveExperienceLevel()) {
            case BEGINNER -> {
                score += 0.3;
                reasons.add("beginner lifter");
            }
            case INTERMEDIATE -> score += 0.1;
            case ADVANCED -> { }
        }

        Double bmi = latestBmi(history.measurements());
        if (bmi != null && bmi > 30) {
            score += 0.2;
            reasons.add("BMI over 30");
        } else if (bmi != null && bmi > 25) {
            score += 0.1;
            reasons.add("BMI over 25");
        }
        return factor(RiskFactor.AGE_FITNESS, score, weight, reasons);
    }

    // ── Monitoring variant ─────────────────────────────────────────

    /**
     * Lightweight risk read used by progress monitoring. Independent of any plan.
     */
    public Result<RiskAssessment> assessForMonitoring(UserProfile profile, TrainingHistory history) {
        requireProfile(profile);
        List<DatedSession> sessions = history.sessions();
        List<FactorScore> factors = new ArrayList<>();

        double intensity = meanIntensity(sessions);
        if (!sessions.isEmpty() && sessionsPerWeek(sessions) > 6 && intensity > 80) {
            factors.add(factor(RiskFactor.FREQUENCY_INTENSITY, 0.3, 1.0,
                List.of("high frequency combined with high intensity")));
        }
        if (sessions.size() >= 4 && hasVolumeSpike(sessions)) {
            factors.add(factor(RiskFactor.VOLUME_SPIKE, 0.2, 1.0,
                List.of("weekly volume jumped more than 50%")));
        }
        if (!profile.injuryHistoryOrEmpty().isEmpty()) {
            factors.add(factor(RiskFactor.INJURY_HISTORY, 0.2, 1.0, List.of("previous injuries on record")));
        }
        if (profile.age() != null && profile.age() > 50) {
            factors.add(factor(RiskFactor.AGE, 0.1, 1.0, List.of("age over 50")));
        }

        double overall = MetricPrimitives.clampScore(factors.stream().mapToDouble(FactorScore::score).sum());
        RiskAssessment assessment = new RiskAssessment(overall,
            RiskLevel.of(overall, thresholds.monitoringHigh(), thresholds.monitoringMedium()),
            RiskVariant.MONITORING, factors, collectReasons(factors), fatigueIndicators(history));
        return Result.ok(assessment, history.warnings());
    }

    private boolean hasVolumeSpike(List<DatedSession> sessions) {
        List<Double> weekly = new ArrayList<>(weeklyVolumes(sessions).values());
        for (int i = 1; i < weekly.size(); i++) {
            if (weekly.get(i - 1) > 0 && weekly.get(i) > weekly.get(i - 1) * 1.5) return true;
        }
        return false;
    }

    // ── Fatigue indicators ─────────────────────────────────────────

    /**
     * Compares the mean volume of the three most recent sessions to the three earliest.
     * High fatigue when recent output falls below {@code fatigueVolumeRatio} of the earlier
     * level or the capped ratio falls below {@code fatigueScoreFloor}.
     */
    public FatigueIndicators fatigueIndicators(TrainingHistory history) {
        List<DatedSession> sessions = history.sessions();
        if (sessions.size() < 5) return FatigueIndicators.unknown();

        List<Double> volumes = sessions.stream().map(DatedSession::volume).toList();
        double earlier = MetricPrimitives.mean(volumes.subList(0, 3));
        double recent = MetricPrimitives.mean(volumes.subList(volumes.size() - 3, volumes.size()));
        double score = MetricPrimitives.clampScore(recent / Math.max(earlier, 1));

        List<String> indicators = new ArrayList<>();
        if (recent < earlier * thresholds.fatigueVolumeRatio()) indicators.add("volume_decline");
        if (score < thresholds.fatigueScoreFloor()) indicators.add("low_performance_ratio");
        return new FatigueIndicators(!indicators.isEmpty(), score, indicators);
    }

    // ── Helpers ────────────────────────────────────────────────────

    private static void requireProfile(UserProfile profile) {
        if (profile == null) throw new AnalysisException(COMPONENT, "user profile is required");
    }

    private static FactorScore factor(RiskFactor factor, double score, double weight, List<String> reasons) {
        return new FactorScore(factor, MetricPrimitives.clampScore(score), weight, List.copyOf(reasons));
    }

    private static List<String> collectReasons(List<FactorScore> factors) {
        List<String> reasons = new ArrayList<>();
        for (FactorScore f : factors) reasons.addAll(f.reasons());
        return reasons;
    }

    private static List<DatedSession> recent(List<DatedSession> sessions) {
        return sessions.subList(Math.max(0, sessions.size() - RECENT_SESSIONS), sessions.size());
    }

    private static double meanIntensity(List<DatedSession> sessions) {
        return sessions.stream()
            .flatMap(s -> s.exercises().stream())
            .filter(DatedExercise::isLoaded)
            .mapToDouble(DatedExercise::intensity)
            .average()
            .orElse(0.0);
    }

    private static double sessionsPerWeek(List<DatedSession> sessions) {
        long span = MetricPrimitives.daysBetween(sessions.get(0).date(), sessions.get(sessions.size() - 1).date());
        return sessions.size() / Math.max(span / 7.0, 1.0);
    }

    /** Session volume summed per ISO week, in chronological week order. */
    static Map<Integer, Double> weeklyVolumes(List<DatedSession> sessions) {
        Map<Integer, Double> weeks = new TreeMap<>();
        for (DatedSession s : sessions) weeks.merge(isoWeekKey(s.date()), s.volume(), Double::sum);
        return weeks;
    }

    private static int isoWeekKey(LocalDateTime date) {
        return date.get(IsoFields.WEEK_BASED_YEAR) * 100 + date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR);
    }

    /** BMI from the latest measurement only; {@code null} when it lacks a weight or height. */
    private static Double latestBmi(List<DatedMeasurement> measurements) {
        if (measurements.isEmpty()) return null;
        DatedMeasurement m = measurements.get(measurements.size() - 1);
        if (m.weight() <= 0 || m.heightCm() == null || m.heightCm() <= 0) return null;
        double meters = m.heightCm() / 100.0;
        return m.weight() / (meters * meters);
    }

    private static String pct(double value) {
        return String.format(Locale.ROOT, "%.1f%%", value);
    }
}
