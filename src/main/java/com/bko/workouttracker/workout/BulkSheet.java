package com.bko.workouttracker.workout;

import java.util.List;

/**
 * Pre-filled inputs for entering every set of a training at once.
 */
public record BulkSheet(String trainingId, List<ExerciseRows> exercises) {

    public BulkSheet {
        exercises = exercises == null ? List.of() : List.copyOf(exercises);
    }

    /**
     * @param lastPerformance most recent history for this exercise name, or {@code null} when there is none
     */
    public record ExerciseRows(String exerciseId, String exerciseName, HistoryRecord lastPerformance, List<SetInput> rows) {
        public ExerciseRows {
            rows = rows == null ? List.of() : List.copyOf(rows);
        }
    }
}
