package com.bko.workouttracker.shared;

public record HealthSyncSettings(boolean enabled, String dailyStepsFile) {
    public boolean isConfigured() {
        return enabled && dailyStepsFile != null && !dailyStepsFile.isBlank();
    }
}
