package com.bko.workouttracker.progress;

import java.time.LocalDate;

/**
 * One history row. {@code delta} is the change against the chronologically previous row, {@code null} for the first.
 */
public record MetricDelta(LocalDate date, String dateLabel, double value, Double delta) {
}
