package com.bko.workouttracker.workout;

import java.time.Instant;
import java.util.List;

/**
 * A completed exercise as it was performed in one training.
 */
public record HistoryRecord(
        String id,
        String traineeId,
        String trainingId,
        String exerciseName,
        Instant completedAt,
        List<ActualSet> sets,
        String notes
) {
    public HistoryRecord {
        sets = sets == null ? List.of() : List.copyOf(sets);
    }

    public double maxWeight() {
        return sets.stream().mapToDouble(ActualSet::weight).max().orElse(0.0);
    }

    public int maxReps() {
        return sets.stream().mapToInt(ActualSet::reps).max().orElse(0);
    }

    public double totalVolume() {
        return sets.stream().mapToDouble(set -> set.weight() * set.reps()).sum();
    }

    public int totalReps() {
        return sets.stream().mapToInt(ActualSet::reps).sum();
    }
}
