package com.bko.workouttracker.workout;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

public interface TrainingStore {
    List<Training> getForTrainee(String traineeId) throws IOException;
    Optional<Training> findById(String trainingId) throws IOException;

    /**
     * Atomically replaces the stored training with the same id, or creates it.
     */
    Training upsert(Training training) throws IOException;
}
