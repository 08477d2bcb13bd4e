package com.bko.workouttracker.progress;

public record GoalProgress(
        String goalId,
        String name,
        GoalType type,
        double percentage,
        String label,
        String deadlineLabel,
        boolean completed
) {
}
