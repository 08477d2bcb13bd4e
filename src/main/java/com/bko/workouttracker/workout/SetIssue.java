package com.bko.workouttracker.workout;

public record SetIssue(String exerciseId, String exerciseName, int setIndex, SetValidationError error) {

    public String describe() {
        String label = (exerciseName == null ? exerciseId : exerciseName) + " - Set " + (setIndex + 1);
        return switch (error) {
            case INVALID_REPS -> label + " (invalid reps)";
            case INVALID_WEIGHT -> label + " (invalid weight)";
            case OUT_OF_ORDER_SET -> label + " (previous sets missing)";
            case SET_OUT_OF_RANGE -> label + " (not prescribed)";
            case UNKNOWN_EXERCISE -> "Unknown exercise " + exerciseId;
            default -> label;
        };
    }
}
