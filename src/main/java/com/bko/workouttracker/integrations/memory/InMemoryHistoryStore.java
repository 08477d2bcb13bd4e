package com.bko.workouttracker.integrations.memory;

import com.bko.workouttracker.workout.Exercise;
import com.bko.workouttracker.workout.HistoryRecord;
import com.bko.workouttracker.workout.HistoryStore;
import com.bko.workouttracker.workout.Training;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Component
public class InMemoryHistoryStore implements HistoryStore {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryHistoryStore.class);

    private final List<HistoryRecord> records = new ArrayList<>();
    private final Clock clock;

    public InMemoryHistoryStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized Optional<HistoryRecord> getLast(String traineeId, String exerciseName) {
        return getHistory(traineeId, exerciseName).stream().findFirst();
    }

    @Override
    public synchronized List<HistoryRecord> getHistory(String traineeId, String exerciseName) {
        return records.stream()
                .filter(record -> record.traineeId().equals(traineeId) && record.exerciseName().equals(exerciseName))
                .sorted(Comparator.comparing(HistoryRecord::completedAt).reversed())
                .toList();
    }

    @Override
    public synchronized void save(Training training) {
        if (!training.completed() || training.completedAt() == null) {
            throw new IllegalStateException("Training must be completed to save history");
        }
        LocalDate day = dayOf(training.completedAt());
        for (Exercise exercise : training.exercises()) {
            if (!exercise.hasLoggedSets()) {
                continue;
            }
            records.removeIf(record -> record.traineeId().equals(training.traineeId())
                    && record.exerciseName().equals(exercise.name())
                    && day.equals(dayOf(record.completedAt())));
            records.add(new HistoryRecord(
                    UUID.randomUUID().toString(),
                    training.traineeId(),
                    training.id(),
                    exercise.name(),
                    training.completedAt(),
                    exercise.actualSets(),
                    training.notes()
            ));
            logger.debug("Saved history for {}: {} sets", exercise.name(), exercise.loggedSets());
        }
    }

    private LocalDate dayOf(Instant instant) {
        return instant.atZone(clock.getZone()).toLocalDate();
    }
}
