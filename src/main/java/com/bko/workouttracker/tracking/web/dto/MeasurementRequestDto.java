package com.bko.workouttracker.tracking.web.dto;

import java.util.Map;

public record MeasurementRequestDto(
        Double weight,
        Map<String, Double> bodyMeasurements
) { }
