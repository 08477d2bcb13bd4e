package com.bko.workouttracker.progress;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Everything the progress dashboard renders for one trainee. Sections that could not be loaded are {@code null}
 * or empty and explained in {@code messages}.
 */
public record ProgressSnapshot(
        String traineeId,
        LocalDate today,
        List<String> messages,
        List<TrainingOverview> trainings,
        int completedTrainings,
        List<GoalProgress> goals,
        WeeklyAverage weeklyWeight,
        Map<String, WeeklyAverage> weeklyBodyMeasurements,
        WeeklyAverage weeklySteps,
        List<MetricDelta> weightHistory,
        CalorieBalance calories
) {
}
