package com.bko.workouttracker.shared;

public record AppSettings(WorkoutSettings workout, HealthSyncSettings healthSync) {
    public boolean isHealthSyncConfigured() {
        return healthSync != null && healthSync.isConfigured();
    }
}
