package com.bko.workouttracker.integrations.memory;

import com.bko.workouttracker.tracking.Measurement;
import com.bko.workouttracker.tracking.MeasurementStore;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Component
public class InMemoryMeasurementStore implements MeasurementStore {
    private final List<Measurement> measurements = new ArrayList<>();
    private final Clock clock;

    public InMemoryMeasurementStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized List<Measurement> getForTrainee(String traineeId) {
        return measurements.stream()
                .filter(m -> m.traineeId().equals(traineeId))
                .sorted(Comparator.comparing(Measurement::date).reversed())
                .toList();
    }

    @Override
    public synchronized Optional<Measurement> getToday(String traineeId) {
        LocalDate today = LocalDate.now(clock);
        return measurements.stream()
                .filter(m -> m.traineeId().equals(traineeId) && m.date().equals(today))
                .findFirst();
    }

    @Override
    public synchronized Measurement upsert(String traineeId, double weight, Map<String, Double> bodyMeasurements) {
        LocalDate today = LocalDate.now(clock);
        int existing = indexOf(traineeId, today);
        String id = existing >= 0 ? measurements.get(existing).id() : UUID.randomUUID().toString();
        Measurement measurement = new Measurement(id, traineeId, today, weight, bodyMeasurements);
        if (existing >= 0) {
            measurements.set(existing, measurement);
        } else {
            measurements.add(measurement);
        }
        return measurement;
    }

    @Override
    public synchronized Optional<Measurement> updateBodyMeasurements(String measurementId, Map<String, Double> bodyMeasurements) {
        for (int i = 0; i < measurements.size(); i++) {
            Measurement current = measurements.get(i);
            if (current.id().equals(measurementId)) {
                Measurement updated = current.withBodyMeasurements(bodyMeasurements);
                measurements.set(i, updated);
                return Optional.of(updated);
            }
        }
        return Optional.empty();
    }

    @Override
    public synchronized void delete(String measurementId) {
        measurements.removeIf(m -> m.id().equals(measurementId));
    }

    private int indexOf(String traineeId, LocalDate date) {
        for (int i = 0; i < measurements.size(); i++) {
            Measurement m = measurements.get(i);
            if (m.traineeId().equals(traineeId) && m.date().equals(date)) {
                return i;
            }
        }
        return -1;
    }
}
