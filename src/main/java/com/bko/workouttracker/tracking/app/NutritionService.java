package com.bko.workouttracker.tracking.app;

import com.bko.workouttracker.tracking.FoodItem;
import com.bko.workouttracker.tracking.NutritionEntry;
import com.bko.workouttracker.tracking.NutritionPlan;
import com.bko.workouttracker.tracking.NutritionStore;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
public class NutritionService {
    private final NutritionStore nutritionStore;
    private final Clock clock;

    public NutritionService(NutritionStore nutritionStore, Clock clock) {
        this.nutritionStore = nutritionStore;
        this.clock = clock;
    }

    /**
     * Adds foods to today's entry, creating the entry on the first meal of the day.
     */
    public NutritionEntry logFoods(String traineeId, List<FoodItem> foods) throws IOException {
        if (foods == null || foods.isEmpty()) {
            throw new IllegalArgumentException("At least one food is required");
        }
        for (FoodItem food : foods) {
            if (food.name() == null || food.name().isBlank()) {
                throw new IllegalArgumentException("Food name is required");
            }
            if (food.calories() < 0) {
                throw new IllegalArgumentException("Calories cannot be negative for " + food.name());
            }
        }
        LocalDate today = LocalDate.now(clock);
        NutritionEntry entry = nutritionStore.getEntry(traineeId, today)
                .orElseGet(() -> new NutritionEntry(UUID.randomUUID().toString(), traineeId, today, List.of()));
        return nutritionStore.upsertEntry(entry.withAddedFoods(foods));
    }

    public Optional<NutritionEntry> today(String traineeId) throws IOException {
        return nutritionStore.getEntry(traineeId, LocalDate.now(clock));
    }

    public Optional<NutritionPlan> plan(String traineeId) throws IOException {
        return nutritionStore.getPlan(traineeId);
    }

    public List<NutritionEntry> history(String traineeId) throws IOException {
        return nutritionStore.getEntries(traineeId);
    }
}
