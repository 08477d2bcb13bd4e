package com.bko.workouttracker.workout.history;

import java.time.Instant;
import java.util.List;

public record TrainingProgressReport(
        String trainingId,
        String trainingName,
        String traineeId,
        Instant completedAt,
        List<ExerciseProgressComparison> comparisons
) {
    public TrainingProgressReport {
        comparisons = comparisons == null ? List.of() : List.copyOf(comparisons);
    }

    public long exercisesWithImprovement() {
        return comparisons.stream().filter(ExerciseProgressComparison::hasImproved).count();
    }

    public int totalExercises() {
        return comparisons.size();
    }

    public double improvementPercentage() {
        return totalExercises() > 0 ? (double) exercisesWithImprovement() / totalExercises() * 100 : 0.0;
    }

    public double totalVolumeIncrease() {
        return comparisons.stream().mapToDouble(ExerciseProgressComparison::volumeProgress).sum();
    }

    public String summary() {
        long improved = exercisesWithImprovement();
        if (improved == 0) {
            return "Performance maintained across all exercises";
        }
        if (improved == totalExercises()) {
            return "Improvement in all exercises!";
        }
        return "Improvement in " + improved + " out of " + totalExercises() + " exercises";
    }
}
