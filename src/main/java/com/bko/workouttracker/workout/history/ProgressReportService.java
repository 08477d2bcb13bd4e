package com.bko.workouttracker.workout.history;

import com.bko.workouttracker.workout.Exercise;
import com.bko.workouttracker.workout.HistoryRecord;
import com.bko.workouttracker.workout.HistoryStore;
import com.bko.workouttracker.workout.Training;
import com.bko.workouttracker.workout.TrainingNotFoundException;
import com.bko.workouttracker.workout.TrainingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Compares a completed training with the trainee's previous performance of each exercise.
 */
@Service
public class ProgressReportService {
    private static final Logger logger = LoggerFactory.getLogger(ProgressReportService.class);

    private final TrainingStore trainingStore;
    private final HistoryStore historyStore;

    public ProgressReportService(TrainingStore trainingStore, HistoryStore historyStore) {
        this.trainingStore = trainingStore;
        this.historyStore = historyStore;
    }

    public TrainingProgressReport generateReport(String trainingId) throws IOException {
        Training training = trainingStore.findById(trainingId)
                .orElseThrow(() -> new TrainingNotFoundException(trainingId));
        return generateReport(training);
    }

    public TrainingProgressReport generateReport(Training training) {
        if (!training.completed()) {
            throw new IllegalStateException("Training must be completed to generate a progress report");
        }
        List<ExerciseProgressComparison> comparisons = new ArrayList<>();
        for (Exercise exercise : training.exercises()) {
            if (!exercise.hasLoggedSets()) {
                continue;
            }
            HistoryRecord previous = previousPerformance(training, exercise.name());
            comparisons.add(new ExerciseProgressComparison(
                    exercise.name(), previous, exercise.actualSets(), training.completedAt()));
        }
        return new TrainingProgressReport(
                training.id(), training.name(), training.traineeId(), training.completedAt(), comparisons);
    }

    // Most recent record that belongs to another training.
    private HistoryRecord previousPerformance(Training training, String exerciseName) {
        try {
            return historyStore.getHistory(training.traineeId(), exerciseName).stream()
                    .filter(record -> !training.id().equals(record.trainingId()))
                    .findFirst()
                    .orElse(null);
        } catch (Exception e) {
            logger.warn("History lookup failed for {}: {}", exerciseName, e.getMessage());
            return null;
        }
    }
}
