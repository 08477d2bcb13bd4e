package com.bko.workouttracker.workout;

import java.io.IOException;
import java.util.Optional;

public interface WorkoutPreferenceStore {
    Optional<String> get(String key) throws IOException;
    void put(String key, String value) throws IOException;
}
