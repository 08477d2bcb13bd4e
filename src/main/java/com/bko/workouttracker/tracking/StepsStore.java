package com.bko.workouttracker.tracking;

import java.io.IOException;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface StepsStore {
    Optional<StepsEntry> getForDate(String traineeId, LocalDate date) throws IOException;

    Optional<StepsEntry> getToday(String traineeId) throws IOException;

    /**
     * Creates or replaces the entry for {@code date}, marked as manual.
     */
    StepsEntry logManual(String traineeId, LocalDate date, int steps) throws IOException;

    /**
     * @return every entry of the trainee, newest first
     */
    List<StepsEntry> getAll(String traineeId) throws IOException;

    void delete(String entryId) throws IOException;
}
