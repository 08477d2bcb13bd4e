package com.bko.workouttracker.workout;

public enum SessionState {
    NOT_STARTED,
    IN_PROGRESS,
    COMPLETED;

    public static SessionState of(Training training) {
        if (training.completed()) {
            return COMPLETED;
        }
        boolean anyLogged = training.exercises().stream().anyMatch(Exercise::hasLoggedSets);
        return anyLogged ? IN_PROGRESS : NOT_STARTED;
    }
}
