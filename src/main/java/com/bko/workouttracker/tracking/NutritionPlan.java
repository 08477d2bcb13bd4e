package com.bko.workouttracker.tracking;

import java.util.Map;

/**
 * Trainer-assigned nutrition plan.
 *
 * @param macros grams per macro nutrient, e.g. {@code protein -> 150}
 */
public record NutritionPlan(String id, String traineeId, String name, int dailyCalories, Map<String, Integer> macros) {
    public NutritionPlan {
        macros = macros == null ? Map.of() : Map.copyOf(macros);
    }
}
