package com.gymcoach.common;

import com.gymcoach.common.model.BodyMeasurement;
import com.gymcoach.common.model.ExerciseRecord;
import com.gymcoach.common.model.ExperienceLevel;
import com.gymcoach.common.model.UserProfile;
import com.gymcoach.common.model.WorkoutSession;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntFunction;

/** Builders for training histories used across the analyzer tests. */
public final class TrainingFixtures {

    public static final LocalDate START = LocalDate.of(2024, 1, 1); // a Monday

    private TrainingFixtures() {}

    public static ExerciseRecord ex(String name, double weight, int reps, int sets) {
        return ExerciseRecord.of(name, weight, reps, sets);
    }

    public static WorkoutSession session(LocalDate date, ExerciseRecord... exercises) {
        return WorkoutSession.of(date.toString(), List.of(exercises));
    }

    /** {@code count} sessions starting at {@link #START}, one every {@code everyDays} days. */
    public static List<WorkoutSession> sessions(int count, int everyDays, IntFunction<List<ExerciseRecord>> exercisesFor) {
        List<WorkoutSession> out = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            out.add(WorkoutSession.of(START.plusDays((long) i * everyDays).toString(), exercisesFor.apply(i)));
        }
        return out;
    }

    /** One exercise per session with the given weights, in order. */
    public static List<WorkoutSession> progression(String exercise, int everyDays, int reps, int sets, double... weights) {
        return sessions(weights.length, everyDays, i -> List.of(ex(exercise, weights[i], reps, sets)));
    }

    public static List<BodyMeasurement> weights(double... kilos) {
        List<BodyMeasurement> out = new ArrayList<>();
        for (int i = 0; i < kilos.length; i++) {
            out.add(BodyMeasurement.of(START.plusWeeks(i).toString(), kilos[i]));
        }
        return out;
    }

    public static UserProfile profile(ExperienceLevel level) {
        return new UserProfile("user-1", level, List.of(), List.of(), null, List.of());
    }

    public static UserProfile profile(ExperienceLevel level, Integer age, List<String> injuries, List<String> equipment) {
        return new UserProfile("user-1", level, equipment, injuries, age, List.of());
    }
}
