package com.bko.workouttracker.workout;

import java.util.Optional;

/**
 * How sets are entered: one at a time ({@link #NORMAL}) or all together ({@link #BULK}).
 */
public enum WorkoutMode {
    NORMAL("normal"),
    BULK("bulk");

    public static final String PREFERENCE_KEY = "workout_mode";

    private final String preferenceValue;

    WorkoutMode(String preferenceValue) {
        this.preferenceValue = preferenceValue;
    }

    public String preferenceValue() {
        return preferenceValue;
    }

    public static Optional<WorkoutMode> fromPreference(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase();
        for (WorkoutMode mode : values()) {
            if (mode.preferenceValue.equals(normalized)) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }
}
