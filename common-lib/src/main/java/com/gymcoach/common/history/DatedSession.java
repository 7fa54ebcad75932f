package com.gymcoach.common.history;

import java.time.LocalDateTime;
import java.util.List;
import java.util.OptionalDouble;

public record DatedSession(
    LocalDateTime       date,
    List<DatedExercise> exercises,
    Integer             durationMinutes
) {
    public DatedSession {
        exercises = List.copyOf(exercises);
    }

    public double volume() {
        double total = 0;
        for (DatedExercise e : exercises) total += e.volume();
        return total;
    }

    /** Mean intensity of the loaded exercises; empty when none are loaded. */
    public OptionalDouble meanIntensity() {
        return exercises.stream()
            .filter(DatedExercise::isLoaded)
            .mapToDouble(DatedExercise::intensity)
            .average();
    }
}
