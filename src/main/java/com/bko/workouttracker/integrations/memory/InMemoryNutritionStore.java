package com.bko.workouttracker.integrations.memory;

import com.bko.workouttracker.tracking.NutritionEntry;
import com.bko.workouttracker.tracking.NutritionPlan;
import com.bko.workouttracker.tracking.NutritionStore;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryNutritionStore implements NutritionStore {
    private final Map<String, NutritionPlan> plansByTrainee = new ConcurrentHashMap<>();
    private final List<NutritionEntry> entries = new ArrayList<>();

    public void putPlan(NutritionPlan plan) {
        plansByTrainee.put(plan.traineeId(), plan);
    }

    @Override
    public Optional<NutritionPlan> getPlan(String traineeId) {
        return Optional.ofNullable(plansByTrainee.get(traineeId));
    }

    @Override
    public synchronized Optional<NutritionEntry> getEntry(String traineeId, LocalDate date) {
        return entries.stream()
                .filter(entry -> entry.traineeId().equals(traineeId) && entry.date().equals(date))
                .findFirst();
    }

    @Override
    public synchronized NutritionEntry upsertEntry(NutritionEntry entry) {
        entries.removeIf(existing -> existing.traineeId().equals(entry.traineeId()) && existing.date().equals(entry.date()));
        entries.add(entry);
        return entry;
    }

    @Override
    public synchronized List<NutritionEntry> getEntries(String traineeId) {
        return entries.stream()
                .filter(entry -> entry.traineeId().equals(traineeId))
                .sorted(Comparator.comparing(NutritionEntry::date).reversed())
                .toList();
    }
}
