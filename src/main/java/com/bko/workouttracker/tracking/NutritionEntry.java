package com.bko.workouttracker.tracking;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Foods a trainee logged for one day.
 */
public record NutritionEntry(String id, String traineeId, LocalDate date, List<FoodItem> consumedFoods) {
    public NutritionEntry {
        consumedFoods = consumedFoods == null ? List.of() : List.copyOf(consumedFoods);
    }

    public int totalCalories() {
        return consumedFoods.stream().mapToInt(FoodItem::calories).sum();
    }

    public NutritionEntry withAddedFoods(List<FoodItem> foods) {
        List<FoodItem> combined = new ArrayList<>(consumedFoods);
        combined.addAll(foods);
        return new NutritionEntry(id, traineeId, date, combined);
    }
}
