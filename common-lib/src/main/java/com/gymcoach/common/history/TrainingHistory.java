package com.gymcoach.common.history;

import com.gymcoach.common.metrics.MetricPrimitives;
import com.gymcoach.common.model.BodyMeasurement;
import com.gymcoach.common.model.ExerciseRecord;
import com.gymcoach.common.model.NutritionDay;
import com.gymcoach.common.model.WorkoutSession;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, normalized copy of one user's historical slice.
 *
 * <p>Normalization rules:
 * <ul>
 *   <li>sessions and measurements with an unparsable date are skipped</li>
 *   <li>an exercise is skipped when its name is blank, its own date is present but
 *       unparsable, or any number is negative or non-finite</li>
 *   <li>surviving sessions, measurements and nutrition days are sorted chronologically
 *       (stable, so same-day entries keep caller order)</li>
 * </ul>
 *
 * <p>Skipped counts are kept so analyzers can report them as warnings. The caller's
 * lists are never mutated.
 */
public final class TrainingHistory {

    private final List<DatedSession>     sessions;
    private final List<DatedMeasurement> measurements;
    private final List<NutritionDay>     nutrition;
    private final int skippedSessions;
    private final int skippedExercises;
    private final int skippedMeasurements;
    private final int skippedNutritionDays;

    private TrainingHistory(List<DatedSession> sessions, List<DatedMeasurement> measurements,
                            List<NutritionDay> nutrition, int skippedSessions, int skippedExercises,
                            int skippedMeasurements, int skippedNutritionDays) {
        this.sessions = List.copyOf(sessions);
        this.measurements = List.copyOf(measurements);
        this.nutrition = List.copyOf(nutrition);
        this.skippedSessions = skippedSessions;
        this.skippedExercises = skippedExercises;
        this.skippedMeasurements = skippedMeasurements;
        this.skippedNutritionDays = skippedNutritionDays;
    }

    public static TrainingHistory empty() {
        return of(List.of(), List.of(), List.of());
    }

    public static TrainingHistory of(List<WorkoutSession> sessions) {
        return of(sessions, List.of(), List.of());
    }

    public static TrainingHistory of(List<WorkoutSession> rawSessions,
                                     List<BodyMeasurement> rawMeasurements,
                                     List<NutritionDay> rawNutrition) {
        List<DatedSession> sessions = new ArrayList<>();
        int skippedSessions = 0;
        int skippedExercises = 0;

        for (WorkoutSession raw : nullSafe(rawSessions)) {
            Optional<LocalDateTime> date = raw == null ? Optional.empty() : MetricPrimitives.parseDate(raw.date());
            if (date.isEmpty()) {
                skippedSessions++;
                continue;
            }
            List<DatedExercise> exercises = new ArrayList<>();
            for (ExerciseRecord record : nullSafe(raw.exercises())) {
                Optional<DatedExercise> exercise = normalize(record, date.get());
                if (exercise.isPresent()) {
                    exercises.add(exercise.get());
                } else {
                    skippedExercises++;
                }
            }
            sessions.add(new DatedSession(date.get(), exercises, raw.durationMinutes()));
        }
        sessions.sort(Comparator.comparing(DatedSession::date));

        List<DatedMeasurement> measurements = new ArrayList<>();
        int skippedMeasurements = 0;
        for (BodyMeasurement raw : nullSafe(rawMeasurements)) {
            Optional<LocalDateTime> date = raw == null ? Optional.empty() : MetricPrimitives.parseDate(raw.date());
            if (date.isEmpty() || !MetricPrimitives.isValidAmount(raw.weight())) {
                skippedMeasurements++;
                continue;
            }
            measurements.add(new DatedMeasurement(date.get(), raw.weight(), raw.bodyFat(), raw.heightCm()));
        }
        measurements.sort(Comparator.comparing(DatedMeasurement::date));

        // nutrition keeps its record type; sort key is the parsed date
        List<Map.Entry<LocalDateTime, NutritionDay>> datedNutrition = new ArrayList<>();
        int skippedNutrition = 0;
        for (NutritionDay raw : nullSafe(rawNutrition)) {
            Optional<LocalDateTime> date = raw == null ? Optional.empty() : MetricPrimitives.parseDate(raw.date());
            if (date.isEmpty() || !validNutrition(raw)) {
                skippedNutrition++;
                continue;
            }
            datedNutrition.add(Map.entry(date.get(), raw));
        }
        datedNutrition.sort(Map.Entry.comparingByKey());
        List<NutritionDay> nutrition = datedNutrition.stream().map(Map.Entry::getValue).toList();

        return new TrainingHistory(sessions, measurements, nutrition,
            skippedSessions, skippedExercises, skippedMeasurements, skippedNutrition);
    }

    private static Optional<DatedExercise> normalize(ExerciseRecord record, LocalDateTime sessionDate) {
        if (record == null || record.name() == null || record.name().isBlank()) return Optional.empty();
        if (!MetricPrimitives.isValidAmount(record.weight()) || record.reps() < 0 || record.effectiveSets() < 0) {
            return Optional.empty();
        }
        LocalDateTime date = sessionDate;
        if (record.date() != null) {
            Optional<LocalDateTime> own = MetricPrimitives.parseDate(record.date());
            if (own.isEmpty()) return Optional.empty();
            date = own.get();
        }
        return Optional.of(new DatedExercise(
            normalizeName(record.name()), record.name().trim(), date,
            record.weight(), record.reps(), record.effectiveSets()));
    }

    private static boolean validNutrition(NutritionDay d) {
        return MetricPrimitives.isValidAmount(d.calories())
            && MetricPrimitives.isValidAmount(d.protein())
            && MetricPrimitives.isValidAmount(d.carbs())
            && MetricPrimitives.isValidAmount(d.fat())
            && MetricPrimitives.isValidAmount(d.calorieGoal())
            && MetricPrimitives.isValidAmount(d.proteinGoal())
            && MetricPrimitives.isValidAmount(d.carbsGoal())
            && MetricPrimitives.isValidAmount(d.fatGoal());
    }

    public static String normalizeName(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list == null ? List.of() : list;
    }

    // ── Views ──────────────────────────────────────────────────────

    public List<DatedSession> sessions() {
        return sessions;
    }

    public List<DatedMeasurement> measurements() {
        return measurements;
    }

    public List<NutritionDay> nutrition() {
        return nutrition;
    }

    /** Every valid exercise across all sessions, in session order. */
    public List<DatedExercise> allExercises() {
        List<DatedExercise> all = new ArrayList<>();
        for (DatedSession s : sessions) all.addAll(s.exercises());
        return all;
    }

    /**
     * Loaded exercises grouped by normalized name, each group sorted by date.
     * Groups appear in first-seen order.
     */
    public Map<String, List<DatedExercise>> loadedExercisesByName() {
        Map<String, List<DatedExercise>> byName = new LinkedHashMap<>();
        for (DatedExercise e : allExercises()) {
            if (!e.isLoaded()) continue;
            byName.computeIfAbsent(e.name(), k -> new ArrayList<>()).add(e);
        }
        byName.replaceAll((k, v) -> {
            List<DatedExercise> sorted = new ArrayList<>(v);
            sorted.sort(Comparator.comparing(DatedExercise::date));
            return List.copyOf(sorted);
        });
        return byName;
    }

    /** Whole-day gaps between consecutive sessions. */
    public List<Double> sessionGaps() {
        List<Double> gaps = new ArrayList<>();
        for (int i = 1; i < sessions.size(); i++) {
            gaps.add((double) MetricPrimitives.daysBetween(sessions.get(i - 1).date(), sessions.get(i).date()));
        }
        return gaps;
    }

    public Optional<LocalDateTime> lastSessionDate() {
        return sessions.isEmpty() ? Optional.empty() : Optional.of(sessions.get(sessions.size() - 1).date());
    }

    public int skippedRecords() {
        return skippedSessions + skippedExercises + skippedMeasurements + skippedNutritionDays;
    }

    /** Human-readable notes about skipped malformed records; empty when nothing was skipped. */
    public List<String> warnings() {
        List<String> warnings = new ArrayList<>();
        if (skippedSessions > 0) warnings.add("skipped " + skippedSessions + " session(s) with unparsable date");
        if (skippedExercises > 0) warnings.add("skipped " + skippedExercises + " malformed exercise record(s)");
        if (skippedMeasurements > 0) warnings.add("skipped " + skippedMeasurements + " malformed measurement(s)");
        if (skippedNutritionDays > 0) warnings.add("skipped " + skippedNutritionDays + " malformed nutrition day(s)");
        return warnings;
    }
}
