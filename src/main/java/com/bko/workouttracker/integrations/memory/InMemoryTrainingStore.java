package com.bko.workouttracker.integrations.memory;

import com.bko.workouttracker.workout.Training;
import com.bko.workouttracker.workout.TrainingStore;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryTrainingStore implements TrainingStore {
    private final Map<String, Training> trainings = new ConcurrentHashMap<>();

    @Override
    public List<Training> getForTrainee(String traineeId) {
        return trainings.values().stream()
                .filter(training -> training.traineeId().equals(traineeId))
                .sorted(Comparator.comparing(Training::scheduledDate, Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();
    }

    @Override
    public Optional<Training> findById(String trainingId) {
        return Optional.ofNullable(trainings.get(trainingId));
    }

    @Override
    public Training upsert(Training training) {
        if (training.id() == null || training.id().isBlank()) {
            throw new IllegalArgumentException("Training id is required");
        }
        trainings.put(training.id(), training);
        return training;
    }
}
