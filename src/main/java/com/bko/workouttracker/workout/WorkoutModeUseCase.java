package com.bko.workouttracker.workout;

import java.io.IOException;

public interface WorkoutModeUseCase {
    /**
     * Mode offered for trainings that have not been started yet.
     */
    WorkoutMode preferredMode();

    WorkoutMode updatePreferredMode(WorkoutMode mode) throws IOException;
}
