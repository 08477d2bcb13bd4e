package com.bko.workouttracker.integrations.memory;

import com.bko.workouttracker.progress.Goal;
import com.bko.workouttracker.tracking.NutritionPlan;
import com.bko.workouttracker.workout.Training;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Trainer-authored data loaded at startup.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SeedData(List<Training> trainings, List<Goal> goals, List<NutritionPlan> nutritionPlans) {
    public SeedData {
        trainings = trainings == null ? List.of() : List.copyOf(trainings);
        goals = goals == null ? List.of() : List.copyOf(goals);
        nutritionPlans = nutritionPlans == null ? List.of() : List.copyOf(nutritionPlans);
    }
}
