package com.bko.workouttracker.workout.history;

import com.bko.workouttracker.workout.ActualSet;
import com.bko.workouttracker.workout.HistoryRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Current sets of an exercise compared with its previous performance. All progress figures are 0 when there is no
 * previous performance or nothing was logged now.
 */
public record ExerciseProgressComparison(
        String exerciseName,
        HistoryRecord previous,
        List<ActualSet> current,
        Instant currentDate
) {
    public ExerciseProgressComparison {
        current = current == null ? List.of() : List.copyOf(current);
    }

    public double weightProgress() {
        if (!comparable()) {
            return 0.0;
        }
        return currentMaxWeight() - previous.maxWeight();
    }

    public int repsProgress() {
        if (!comparable()) {
            return 0;
        }
        int currentMax = current.stream().mapToInt(ActualSet::reps).max().orElse(0);
        return currentMax - previous.maxReps();
    }

    public double volumeProgress() {
        if (!comparable()) {
            return 0.0;
        }
        double currentVolume = current.stream().mapToDouble(set -> set.weight() * set.reps()).sum();
        return currentVolume - previous.totalVolume();
    }

    public double weightProgressPercentage() {
        if (!comparable() || previous.maxWeight() == 0) {
            return 0.0;
        }
        return (currentMaxWeight() - previous.maxWeight()) / previous.maxWeight() * 100;
    }

    public boolean hasImproved() {
        return weightProgress() > 0 || repsProgress() > 0 || volumeProgress() > 0;
    }

    public String description() {
        if (previous == null) {
            return "First time doing this exercise";
        }
        List<String> changes = new ArrayList<>();
        double weight = weightProgress();
        if (weight > 0) {
            changes.add(String.format(Locale.ROOT, "%.1fkg weight increase", weight));
        } else if (weight < 0) {
            changes.add(String.format(Locale.ROOT, "%.1fkg weight decrease", -weight));
        }
        int reps = repsProgress();
        if (reps > 0) {
            changes.add(reps + " more reps");
        } else if (reps < 0) {
            changes.add(-reps + " fewer reps");
        }
        return changes.isEmpty() ? "Performance maintained" : String.join(", ", changes);
    }

    private boolean comparable() {
        return previous != null && !current.isEmpty();
    }

    private double currentMaxWeight() {
        return current.stream().mapToDouble(ActualSet::weight).max().orElse(0.0);
    }
}
