package com.bko.workouttracker.progress;

/**
 * Logged sets against prescribed sets. A training without exercises reports 0/0.
 */
public record TrainingProgress(int completedSets, int totalSets) {

    public double ratio() {
        return totalSets == 0 ? 0.0 : (double) completedSets / totalSets;
    }

    public String percentLabel() {
        return Math.round(ratio() * 100) + "%";
    }

    public String setsLabel() {
        return completedSets + "/" + totalSets + " sets";
    }
}
