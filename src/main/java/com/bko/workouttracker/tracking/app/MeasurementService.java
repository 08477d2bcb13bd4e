package com.bko.workouttracker.tracking.app;

import com.bko.workouttracker.tracking.BodyDimension;
import com.bko.workouttracker.tracking.Measurement;
import com.bko.workouttracker.tracking.MeasurementStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class MeasurementService {
    private static final Logger logger = LoggerFactory.getLogger(MeasurementService.class);

    private final MeasurementStore measurementStore;

    public MeasurementService(MeasurementStore measurementStore) {
        this.measurementStore = measurementStore;
    }

    /**
     * Records today's weight and body dimensions. A second call on the same day replaces the first.
     */
    public Measurement record(String traineeId, double weight, Map<String, Double> bodyMeasurements) throws IOException {
        if (!Double.isFinite(weight) || weight <= 0) {
            throw new IllegalArgumentException("Weight must be a positive number");
        }
        Measurement saved = measurementStore.upsert(traineeId, weight, normalize(bodyMeasurements));
        logger.info("Recorded measurement for trainee {} on {}", traineeId, saved.date());
        return saved;
    }

    public List<Measurement> history(String traineeId) throws IOException {
        return measurementStore.getForTrainee(traineeId);
    }

    public Optional<Measurement> today(String traineeId) throws IOException {
        return measurementStore.getToday(traineeId);
    }

    public Optional<Double> latestWeight(String traineeId) throws IOException {
        return measurementStore.getForTrainee(traineeId).stream()
                .findFirst()
                .map(Measurement::weight);
    }

    public Optional<Measurement> updateBodyMeasurements(String measurementId, Map<String, Double> bodyMeasurements)
            throws IOException {
        return measurementStore.updateBodyMeasurements(measurementId, normalize(bodyMeasurements));
    }

    public void delete(String measurementId) throws IOException {
        measurementStore.delete(measurementId);
    }

    private Map<String, Double> normalize(Map<String, Double> bodyMeasurements) {
        Map<String, Double> normalized = new LinkedHashMap<>();
        if (bodyMeasurements == null) {
            return normalized;
        }
        bodyMeasurements.forEach((key, value) -> {
            String dimension = key == null ? "" : key.trim().toLowerCase();
            if (BodyDimension.fromKey(dimension).isEmpty()) {
                throw new IllegalArgumentException("Unknown body dimension: " + key);
            }
            if (value == null) {
                return;
            }
            if (!Double.isFinite(value) || value <= 0) {
                throw new IllegalArgumentException("Body dimension " + dimension + " must be a positive number");
            }
            normalized.put(dimension, value);
        });
        return normalized;
    }
}
