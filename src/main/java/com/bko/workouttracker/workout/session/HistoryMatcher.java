package com.bko.workouttracker.workout.session;

import com.bko.workouttracker.workout.HistoryRecord;
import com.bko.workouttracker.workout.HistoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Looks up the last performance of an exercise by trainee and exact exercise name.
 * A failed lookup is reported as no history.
 */
public class HistoryMatcher {
    private static final Logger logger = LoggerFactory.getLogger(HistoryMatcher.class);

    private final HistoryStore historyStore;

    public HistoryMatcher(HistoryStore historyStore) {
        this.historyStore = historyStore;
    }

    public Optional<HistoryRecord> findLastPerformance(String traineeId, String exerciseName) {
        if (traineeId == null || exerciseName == null || exerciseName.isEmpty()) {
            return Optional.empty();
        }
        try {
            Optional<HistoryRecord> last = historyStore.getLast(traineeId, exerciseName);
            return last == null ? Optional.empty() : last;
        } catch (Exception e) {
            logger.warn("History lookup failed for {} / {}: {}", traineeId, exerciseName, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Looks up every name independently; names without history are left out of the result.
     */
    public Map<String, HistoryRecord> findLastPerformances(String traineeId, Collection<String> exerciseNames) {
        Map<String, HistoryRecord> found = new LinkedHashMap<>();
        for (String name : exerciseNames) {
            if (found.containsKey(name)) {
                continue;
            }
            findLastPerformance(traineeId, name).ifPresent(record -> found.put(name, record));
        }
        return found;
    }
}
