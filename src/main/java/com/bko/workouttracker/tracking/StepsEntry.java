package com.bko.workouttracker.tracking;

import java.time.LocalDate;

public record StepsEntry(String id, String traineeId, LocalDate date, int steps, StepsOrigin origin) {
    public boolean isManual() {
        return origin == StepsOrigin.MANUAL;
    }
}
