package com.gymcoach.common.monitor;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gymcoach.common.model.NutritionDay;

import java.util.List;

/**
 * Daily intake adherence against the day's goals.
 *
 * <p>Each macro scores 1.0 inside ±10% of its goal, 0.8 inside ±20%, otherwise
 * {@code max(0, 1 − |ratio − 1|)}. Calories use tighter bands (±5% and ±10%).
 * A goal of 0 scores 1.0. A day's adherence is the mean of the four scores.
 */
public record NutritionAdherence(
    @JsonProperty("daysLogged")       int          daysLogged,
    @JsonProperty("averageAdherence") double       averageAdherence,
    @JsonProperty("dailyAdherence")   List<Double> dailyAdherence
) {

    public static NutritionAdherence of(List<NutritionDay> days) {
        List<Double> daily = days.stream().map(NutritionAdherence::dayScore).toList();
        double average = daily.isEmpty() ? 0.0
            : daily.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        return new NutritionAdherence(daily.size(), average, daily);
    }

    public static double dayScore(NutritionDay day) {
        return (macroScore(day.protein(), day.proteinGoal())
            + macroScore(day.carbs(), day.carbsGoal())
            + macroScore(day.fat(), day.fatGoal())
            + calorieScore(day.calories(), day.calorieGoal())) / 4.0;
    }

    static double macroScore(double actual, double goal) {
        return banded(actual, goal, 0.10, 0.20);
    }

    static double calorieScore(double actual, double goal) {
        return banded(actual, goal, 0.05, 0.10);
    }

    private static double banded(double actual, double goal, double tight, double loose) {
        if (goal <= 0) return 1.0;
        double ratio = actual / goal;
        double off = Math.abs(ratio - 1);
        if (off <= tight + 1e-9) return 1.0;
        if (off <= loose + 1e-9) return 0.8;
        return Math.max(0.0, 1 - off);
    }
}
