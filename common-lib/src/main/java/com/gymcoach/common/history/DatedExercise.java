package com.gymcoach.common.history;

import com.gymcoach.common.metrics.MetricPrimitives;

import java.time.LocalDateTime;

/**
 * A validated exercise with a parsed timestamp and a normalized (trimmed, lower-case) name.
 * {@code displayName} keeps the caller's spelling for output.
 */
public record DatedExercise(
    String        name,
    String        displayName,
    LocalDateTime date,
    double        weight,
    int           reps,
    int           sets
) {
    /** Loaded means it carries a usable 1RM: both weight and reps are positive. */
    public boolean isLoaded() {
        return weight > 0 && reps > 0;
    }

    public double oneRepMax() {
        return MetricPrimitives.estimatedOneRepMax(weight, reps);
    }

    public double intensity() {
        return MetricPrimitives.intensityPercent(weight, reps);
    }

    public double volume() {
        return MetricPrimitives.volume(weight, reps, sets);
    }
}
