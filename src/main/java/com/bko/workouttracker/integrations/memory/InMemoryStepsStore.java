package com.bko.workouttracker.integrations.memory;

import com.bko.workouttracker.tracking.StepsEntry;
import com.bko.workouttracker.tracking.StepsOrigin;
import com.bko.workouttracker.tracking.StepsStore;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Component
public class InMemoryStepsStore implements StepsStore {
    private final List<StepsEntry> entries = new ArrayList<>();
    private final Clock clock;

    public InMemoryStepsStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized Optional<StepsEntry> getForDate(String traineeId, LocalDate date) {
        return entries.stream()
                .filter(entry -> entry.traineeId().equals(traineeId) && entry.date().equals(date))
                .findFirst();
    }

    @Override
    public synchronized Optional<StepsEntry> getToday(String traineeId) {
        return getForDate(traineeId, LocalDate.now(clock));
    }

    @Override
    public synchronized StepsEntry logManual(String traineeId, LocalDate date, int steps) {
        Optional<StepsEntry> existing = getForDate(traineeId, date);
        String id = existing.map(StepsEntry::id).orElseGet(() -> UUID.randomUUID().toString());
        StepsEntry entry = new StepsEntry(id, traineeId, date, steps, StepsOrigin.MANUAL);
        existing.ifPresent(entries::remove);
        entries.add(entry);
        return entry;
    }

    @Override
    public synchronized List<StepsEntry> getAll(String traineeId) {
        return entries.stream()
                .filter(entry -> entry.traineeId().equals(traineeId))
                .sorted(Comparator.comparing(StepsEntry::date).reversed())
                .toList();
    }

    @Override
    public synchronized void delete(String entryId) {
        entries.removeIf(entry -> entry.id().equals(entryId));
    }
}
