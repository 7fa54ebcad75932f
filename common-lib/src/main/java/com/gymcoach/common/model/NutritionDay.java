package com.gymcoach.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One day of logged intake against that day's goals. A goal of 0 means "no goal set"
 * and counts as full adherence for that macro.
 */
public record NutritionDay(
    @JsonProperty("date")        String date,
    @JsonProperty("calories")    double calories,
    @JsonProperty("protein")     double protein,
    @JsonProperty("carbs")       double carbs,
    @JsonProperty("fat")         double fat,
    @JsonProperty("calorieGoal") double calorieGoal,
    @JsonProperty("proteinGoal") double proteinGoal,
    @JsonProperty("carbsGoal")   double carbsGoal,
    @JsonProperty("fatGoal")     double fatGoal
) {}
