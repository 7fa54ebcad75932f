package com.gymcoach.common.history;

import java.time.LocalDateTime;

public record DatedMeasurement(
    LocalDateTime date,
    double        weight,
    Double        bodyFat,
    Double        heightCm
) {}
