package com.bko.workouttracker.tracking;

import java.io.IOException;

/**
 * Step count reported by the trainee's device.
 */
public interface HealthSync {
    boolean isAvailable();

    int getTodaySteps() throws IOException;
}
