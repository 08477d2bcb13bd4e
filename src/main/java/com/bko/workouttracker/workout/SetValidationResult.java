package com.bko.workouttracker.workout;

/**
 * Either a valid {@link ActualSet} or the reason the entry was rejected.
 */
public record SetValidationResult(ActualSet set, SetValidationError error) {

    public static SetValidationResult valid(ActualSet set) {
        return new SetValidationResult(set, null);
    }

    public static SetValidationResult invalid(SetValidationError error) {
        return new SetValidationResult(null, error);
    }

    public boolean isValid() {
        return error == null;
    }

    /**
     * At least one field was left blank, so nothing was entered for this set.
     */
    public boolean isNotEntered() {
        return error == SetValidationError.EMPTY_FIELD;
    }
}
