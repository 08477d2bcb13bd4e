package com.bko.workouttracker.workout.session;

import com.bko.workouttracker.workout.ActualSet;
import com.bko.workouttracker.workout.SetValidationError;
import com.bko.workouttracker.workout.SetValidationResult;

import java.util.regex.Pattern;

/**
 * Validates what a trainee typed for a single set. Stateless.
 */
public class SetValidator {
    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)");

    public SetValidationResult validate(String repsText, String weightText) {
        String reps = repsText == null ? "" : repsText.trim();
        String weight = weightText == null ? "" : weightText.trim();
        if (reps.isEmpty() || weight.isEmpty()) {
            return SetValidationResult.invalid(SetValidationError.EMPTY_FIELD);
        }

        Integer parsedReps = parseReps(reps);
        if (parsedReps == null || parsedReps <= 0) {
            return SetValidationResult.invalid(SetValidationError.INVALID_REPS);
        }
        Double parsedWeight = parseWeight(weight);
        if (parsedWeight == null || parsedWeight < 0) {
            return SetValidationResult.invalid(SetValidationError.INVALID_WEIGHT);
        }
        return SetValidationResult.valid(new ActualSet(parsedReps, parsedWeight));
    }

    /**
     * Re-checks a set that was already stored.
     */
    public SetValidationResult validate(ActualSet set) {
        if (set == null) {
            return SetValidationResult.invalid(SetValidationError.EMPTY_FIELD);
        }
        if (set.reps() <= 0) {
            return SetValidationResult.invalid(SetValidationError.INVALID_REPS);
        }
        if (!Double.isFinite(set.weight()) || set.weight() < 0) {
            return SetValidationResult.invalid(SetValidationError.INVALID_WEIGHT);
        }
        return SetValidationResult.valid(set);
    }

    private Integer parseReps(String value) {
        if (!INTEGER.matcher(value).matches()) {
            return null;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private Double parseWeight(String value) {
        if (!DECIMAL.matcher(value).matches()) {
            return null;
        }
        double parsed = Double.parseDouble(value);
        return Double.isFinite(parsed) ? parsed : null;
    }
}
