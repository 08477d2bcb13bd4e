package com.bko.workouttracker.progress;

public interface ProgressUseCase {
    ProgressSnapshot loadProgress(String traineeId);
}
