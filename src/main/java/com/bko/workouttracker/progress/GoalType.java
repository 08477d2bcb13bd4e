package com.bko.workouttracker.progress;

public enum GoalType {
    WEIGHT,
    MEASUREMENT,
    PERFORMANCE
}
