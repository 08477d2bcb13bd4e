package com.bko.workouttracker.tracking;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Body weight and optional body dimensions of a trainee for one calendar day.
 *
 * @param bodyMeasurements dimension key (see {@link BodyDimension}) to centimetres, possibly empty
 */
public record Measurement(
        String id,
        String traineeId,
        LocalDate date,
        double weight,
        Map<String, Double> bodyMeasurements
) {
    public Measurement {
        bodyMeasurements = bodyMeasurements == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(bodyMeasurements));
    }

    public Measurement withBodyMeasurements(Map<String, Double> updated) {
        return new Measurement(id, traineeId, date, weight, updated);
    }
}
