package com.bko.workouttracker.shared;

/**
 * Workout logging settings.
 *
 * @param defaultMode     mode used for new trainings when no preference has been saved ("normal" or "bulk")
 * @param preferencesPath JSON file holding the persisted trainee preferences
 * @param seedFile        optional JSON file with trainer-authored trainings, goals and nutrition plans
 */
public record WorkoutSettings(String defaultMode, String preferencesPath, String seedFile) {
    public static final String DEFAULT_MODE = "normal";
    public static final String DEFAULT_PREFERENCES_PATH = "data/preferences.json";

    public WorkoutSettings {
        defaultMode = hasText(defaultMode) ? defaultMode.trim().toLowerCase() : DEFAULT_MODE;
        preferencesPath = hasText(preferencesPath) ? preferencesPath.trim() : DEFAULT_PREFERENCES_PATH;
        seedFile = hasText(seedFile) ? seedFile.trim() : null;
    }

    public boolean hasSeedFile() {
        return seedFile != null;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
