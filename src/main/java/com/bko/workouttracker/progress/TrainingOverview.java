package com.bko.workouttracker.progress;

public record TrainingOverview(
        String trainingId,
        String name,
        String scheduledLabel,
        boolean completed,
        TrainingProgress progress
) {
}
