package com.bko.workouttracker.workout.session;

import com.bko.workouttracker.shared.AppSettings;
import com.bko.workouttracker.workout.WorkoutMode;
import com.bko.workouttracker.workout.WorkoutModeUseCase;
import com.bko.workouttracker.workout.WorkoutPreferenceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Optional;

@Service
public class WorkoutModePreferences implements WorkoutModeUseCase {
    private static final Logger logger = LoggerFactory.getLogger(WorkoutModePreferences.class);

    private final WorkoutPreferenceStore preferenceStore;
    private final AppSettings settings;

    public WorkoutModePreferences(WorkoutPreferenceStore preferenceStore, AppSettings settings) {
        this.preferenceStore = preferenceStore;
        this.settings = settings;
    }

    @Override
    public WorkoutMode preferredMode() {
        try {
            Optional<WorkoutMode> stored = preferenceStore.get(WorkoutMode.PREFERENCE_KEY)
                    .flatMap(WorkoutMode::fromPreference);
            if (stored.isPresent()) {
                return stored.get();
            }
        } catch (IOException e) {
            logger.warn("Could not read workout mode preference: {}", e.getMessage());
        }
        return defaultMode();
    }

    @Override
    public WorkoutMode updatePreferredMode(WorkoutMode mode) throws IOException {
        preferenceStore.put(WorkoutMode.PREFERENCE_KEY, mode.preferenceValue());
        logger.info("Workout mode preference set to {}", mode.preferenceValue());
        return mode;
    }

    private WorkoutMode defaultMode() {
        if (settings == null || settings.workout() == null) {
            return WorkoutMode.NORMAL;
        }
        return WorkoutMode.fromPreference(settings.workout().defaultMode()).orElse(WorkoutMode.NORMAL);
    }
}
