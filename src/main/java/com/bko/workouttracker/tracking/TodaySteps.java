package com.bko.workouttracker.tracking;

import java.time.LocalDate;

public record TodaySteps(LocalDate date, int steps, StepsOrigin origin) {
}
