package com.bko.workouttracker.workout;

public enum Difficulty {
    BEGINNER,
    INTERMEDIATE,
    ADVANCED
}
