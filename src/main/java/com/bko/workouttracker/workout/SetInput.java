package com.bko.workouttracker.workout;

/**
 * Raw text typed for one set.
 */
public record SetInput(String reps, String weight) {
    public static SetInput blank() {
        return new SetInput("", "");
    }
}
