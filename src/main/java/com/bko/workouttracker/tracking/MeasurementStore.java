package com.bko.workouttracker.tracking;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface MeasurementStore {
    /**
     * @return the trainee's measurements, newest first
     */
    List<Measurement> getForTrainee(String traineeId) throws IOException;

    Optional<Measurement> getToday(String traineeId) throws IOException;

    /**
     * Creates today's measurement, or replaces it when one already exists for today.
     */
    Measurement upsert(String traineeId, double weight, Map<String, Double> bodyMeasurements) throws IOException;

    Optional<Measurement> updateBodyMeasurements(String measurementId, Map<String, Double> bodyMeasurements) throws IOException;

    void delete(String measurementId) throws IOException;
}
