package com.bko.workouttracker.tracking;

import java.io.IOException;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface NutritionStore {
    Optional<NutritionPlan> getPlan(String traineeId) throws IOException;

    Optional<NutritionEntry> getEntry(String traineeId, LocalDate date) throws IOException;

    /**
     * Creates or replaces the entry for the entry's trainee and date.
     */
    NutritionEntry upsertEntry(NutritionEntry entry) throws IOException;

    /**
     * @return every entry of the trainee, newest first
     */
    List<NutritionEntry> getEntries(String traineeId) throws IOException;
}
