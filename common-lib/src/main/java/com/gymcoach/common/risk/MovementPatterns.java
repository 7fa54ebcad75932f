package com.gymcoach.common.risk;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keyword classification of exercise names into movement patterns and muscle groups.
 * Names are expected normalized (trimmed, lower-case).
 */
public final class MovementPatterns {

    public enum Pattern { KNEE_DOMINANT, HIP_DOMINANT, PUSH, PULL }

    public enum MuscleGroup { CHEST, BACK, SHOULDERS, BICEPS, TRICEPS, QUADS, HAMSTRINGS, GLUTES }

    // both tables match in insertion order: the first entry whose keyword matches wins
    private static final Map<Pattern, List<String>> PATTERN_KEYWORDS = new LinkedHashMap<>();
    static {
        PATTERN_KEYWORDS.put(Pattern.KNEE_DOMINANT, List.of("squat", "lunge", "leg press"));
        PATTERN_KEYWORDS.put(Pattern.HIP_DOMINANT,  List.of("deadlift", "hip thrust", "romanian"));
        PATTERN_KEYWORDS.put(Pattern.PUSH,          List.of("press", "push", "bench"));
        PATTERN_KEYWORDS.put(Pattern.PULL,          List.of("pull", "row", "lat"));
    }

    private static final Map<MuscleGroup, List<String>> MUSCLE_KEYWORDS = new LinkedHashMap<>();
    static {
        MUSCLE_KEYWORDS.put(MuscleGroup.CHEST,      List.of("chest", "bench", "press"));
        MUSCLE_KEYWORDS.put(MuscleGroup.BACK,       List.of("back", "row", "pull", "lat"));
        MUSCLE_KEYWORDS.put(MuscleGroup.SHOULDERS,  List.of("shoulder", "deltoid", "overhead"));
        MUSCLE_KEYWORDS.put(MuscleGroup.BICEPS,     List.of("bicep", "curl"));
        MUSCLE_KEYWORDS.put(MuscleGroup.TRICEPS,    List.of("tricep", "extension"));
        MUSCLE_KEYWORDS.put(MuscleGroup.QUADS,      List.of("quad", "squat", "leg press"));
        MUSCLE_KEYWORDS.put(MuscleGroup.HAMSTRINGS, List.of("hamstring", "deadlift", "romanian"));
        MUSCLE_KEYWORDS.put(MuscleGroup.GLUTES,     List.of("glute", "hip", "thrust"));
    }

    static final List<String> HIGH_RISK_KEYWORDS = List.of("overhead", "snatch", "clean", "jerk", "plyometric");

    static final List<String> FREE_WEIGHT_KEYWORDS = List.of("barbell", "dumbbell", "kettlebell");

    private MovementPatterns() { /* utility class */ }

    /**
     * First matching pattern in knee, hip, push, pull order, or {@code null} when none
     * matches. "leg press" is knee-dominant only.
     */
    public static Pattern patternOf(String name) {
        for (Map.Entry<Pattern, List<String>> e : PATTERN_KEYWORDS.entrySet()) {
            if (containsAny(name, e.getValue())) return e.getKey();
        }
        return null;
    }

    /** First matching muscle group, or {@code null} when none matches. */
    public static MuscleGroup muscleGroupOf(String name) {
        for (Map.Entry<MuscleGroup, List<String>> e : MUSCLE_KEYWORDS.entrySet()) {
            if (containsAny(name, e.getValue())) return e.getKey();
        }
        return null;
    }

    static boolean containsAny(String name, List<String> keywords) {
        for (String k : keywords) {
            if (name.contains(k)) return true;
        }
        return false;
    }
}
