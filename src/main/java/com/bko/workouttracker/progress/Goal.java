package com.bko.workouttracker.progress;

import java.time.LocalDate;

/**
 * A trainer-assigned goal. All goal types share the same progress contract.
 */
public record Goal(
        String id,
        String traineeId,
        GoalType type,
        String name,
        double currentValue,
        double targetValue,
        String unit,
        LocalDate deadline,
        boolean completed
) {
    /**
     * Current value as a share of the target, in percent. Derived, never stored; 0 when no target is set.
     * Not clamped here.
     */
    public double progressPercentage() {
        if (targetValue == 0) {
            return 0;
        }
        return currentValue / targetValue * 100;
    }
}
