package com.bko.workouttracker.workout;

import java.util.ArrayList;
import java.util.List;

/**
 * An exercise prescribed inside a training. {@code actualSets.get(i)} is the logged result of set {@code i + 1}.
 */
public record Exercise(
        String id,
        String name,
        int sets,
        int reps,
        Double targetWeight,
        String instructions,
        List<ActualSet> actualSets
) {
    public Exercise {
        instructions = instructions == null ? "" : instructions;
        actualSets = actualSets == null ? List.of() : List.copyOf(actualSets);
    }

    public int loggedSets() {
        return actualSets.size();
    }

    public boolean hasLoggedSets() {
        return !actualSets.isEmpty();
    }

    /**
     * Some, but not all, prescribed sets are logged.
     */
    public boolean isPartial() {
        return !actualSets.isEmpty() && actualSets.size() < sets;
    }

    public boolean isFilled() {
        return sets > 0 && actualSets.size() >= sets;
    }

    public Exercise withActualSets(List<ActualSet> updated) {
        return new Exercise(id, name, sets, reps, targetWeight, instructions, updated);
    }

    /**
     * Replaces the set at {@code index}, or appends it when {@code index == loggedSets()}.
     */
    public Exercise withSet(int index, ActualSet set) {
        if (index < 0 || index > actualSets.size()) {
            throw new IndexOutOfBoundsException("Set index " + index + " leaves a gap after " + actualSets.size() + " sets");
        }
        List<ActualSet> updated = new ArrayList<>(actualSets);
        if (index == updated.size()) {
            updated.add(set);
        } else {
            updated.set(index, set);
        }
        return withActualSets(updated);
    }
}
