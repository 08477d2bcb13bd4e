package com.bko.workouttracker.workout;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Performance history keyed by trainee and exact, case-sensitive exercise name.
 */
public interface HistoryStore {
    Optional<HistoryRecord> getLast(String traineeId, String exerciseName) throws IOException;

    /**
     * @return matching records, most recent first
     */
    List<HistoryRecord> getHistory(String traineeId, String exerciseName) throws IOException;

    /**
     * Records every performed exercise of a completed training, one record per (trainee, exercise name, day).
     */
    void save(Training training) throws IOException;
}
