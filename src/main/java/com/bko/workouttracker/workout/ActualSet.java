package com.bko.workouttracker.workout;

/**
 * One logged set of an exercise. Values are stored as entered; {@code SetValidator} decides whether they are valid.
 */
public record ActualSet(int reps, double weight) {
}
