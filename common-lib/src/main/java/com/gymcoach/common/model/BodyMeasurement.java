package com.gymcoach.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Point-in-time body measurement. Only {@code weight} drives the body-composition
 * trend; {@code heightCm} feeds the BMI rule of the age/fitness risk factor.
 */
public record BodyMeasurement(
    @JsonProperty("date")     String date,
    @JsonProperty("weight")   double weight,
    @JsonProperty("bodyFat")  Double bodyFat,
    @JsonProperty("heightCm") Double heightCm
) {
    public static BodyMeasurement of(String date, double weight) {
        return new BodyMeasurement(date, weight, null, null);
    }
}
