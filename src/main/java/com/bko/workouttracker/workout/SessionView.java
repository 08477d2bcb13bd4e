package com.bko.workouttracker.workout;

public record SessionView(Training training, WorkoutMode mode, SessionState state) {
}
