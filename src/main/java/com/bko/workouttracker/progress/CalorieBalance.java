package com.bko.workouttracker.progress;

public record CalorieBalance(int dailyTarget, int consumed) {

    /**
     * Negative once more was eaten than the target.
     */
    public int remaining() {
        return dailyTarget - consumed;
    }

    public boolean isOver() {
        return consumed > dailyTarget;
    }

    public int magnitude() {
        return Math.abs(remaining());
    }
}
