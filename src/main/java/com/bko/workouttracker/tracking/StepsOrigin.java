package com.bko.workouttracker.tracking;

public enum StepsOrigin {
    MANUAL,
    DEVICE_SYNC,
    /**
     * No reading exists for the day. Only reported by {@link TodaySteps}, never stored.
     */
    NONE
}
