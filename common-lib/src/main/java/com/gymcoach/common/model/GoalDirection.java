package com.gymcoach.common.model;

import java.util.List;
import java.util.Locale;

/**
 * Which way body weight should move for the user's goal. Drives how the
 * body-composition trend labels a weight change.
 */
public enum GoalDirection {

    /** Weight decrease is improvement. */
    LOSE_WEIGHT,

    /** Weight increase is improvement. */
    GAIN_WEIGHT,

    /** Staying inside the stable band is stable; leaving it in either direction is decline. */
    MAINTAIN;

    private static final List<String> GAIN_KEYWORDS = List.of("gain", "bulk", "mass", "muscle");
    private static final List<String> MAINTAIN_KEYWORDS = List.of("maintain", "maintenance", "recomp");

    /**
     * Derives a direction from free-form profile goals. The first goal that matches a
     * keyword wins; anything else (including no goals) falls back to {@link #LOSE_WEIGHT}.
     */
    public static GoalDirection fromGoals(List<String> goals) {
        if (goals == null) return LOSE_WEIGHT;
        for (String goal : goals) {
            if (goal == null) continue;
            String g = goal.toLowerCase(Locale.ROOT);
            if (GAIN_KEYWORDS.stream().anyMatch(g::contains)) return GAIN_WEIGHT;
            if (MAINTAIN_KEYWORDS.stream().anyMatch(g::contains)) return MAINTAIN;
            if (g.contains("lose") || g.contains("loss") || g.contains("cut")) return LOSE_WEIGHT;
        }
        return LOSE_WEIGHT;
    }
}
