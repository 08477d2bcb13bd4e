package com.bko.workouttracker.workout;

public enum SetValidationError {
    EMPTY_FIELD,
    INVALID_REPS,
    INVALID_WEIGHT,
    OUT_OF_ORDER_SET,
    SET_OUT_OF_RANGE,
    UNKNOWN_EXERCISE
}
