package com.bko.workouttracker.progress;

/**
 * Mean of the values recorded from Monday to today. Only built when at least one value exists.
 */
public record WeeklyAverage(double average, int count) {
}
