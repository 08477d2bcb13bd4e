package com.bko.workouttracker.tracking.app;

import com.bko.workouttracker.tracking.HealthSync;
import com.bko.workouttracker.tracking.StepsEntry;
import com.bko.workouttracker.tracking.StepsOrigin;
import com.bko.workouttracker.tracking.StepsStore;
import com.bko.workouttracker.tracking.TodaySteps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Service
public class StepsService {
    private static final Logger logger = LoggerFactory.getLogger(StepsService.class);

    private final StepsStore stepsStore;
    private final HealthSync healthSync;
    private final Clock clock;

    public StepsService(StepsStore stepsStore, HealthSync healthSync, Clock clock) {
        this.stepsStore = stepsStore;
        this.healthSync = healthSync;
        this.clock = clock;
    }

    /**
     * A manual entry for today always wins. Otherwise the live device count is used, then the stored entry with its
     * own origin, then zero with {@link StepsOrigin#NONE}.
     */
    public TodaySteps todaySteps(String traineeId) throws IOException {
        LocalDate today = LocalDate.now(clock);
        Optional<StepsEntry> stored = stepsStore.getToday(traineeId);
        if (stored.isPresent() && stored.get().isManual()) {
            return new TodaySteps(today, stored.get().steps(), StepsOrigin.MANUAL);
        }
        if (healthSync.isAvailable()) {
            try {
                return new TodaySteps(today, healthSync.getTodaySteps(), StepsOrigin.DEVICE_SYNC);
            } catch (Exception e) {
                logger.warn("Health sync failed, falling back to stored steps: {}", e.getMessage());
            }
        }
        return stored
                .map(entry -> new TodaySteps(today, entry.steps(), entry.origin()))
                .orElseGet(() -> new TodaySteps(today, 0, StepsOrigin.NONE));
    }

    public StepsEntry logManual(String traineeId, LocalDate date, int steps) throws IOException {
        if (steps < 0) {
            throw new IllegalArgumentException("Steps cannot be negative");
        }
        LocalDate day = date == null ? LocalDate.now(clock) : date;
        return stepsStore.logManual(traineeId, day, steps);
    }

    public Optional<StepsEntry> stepsFor(String traineeId, LocalDate date) throws IOException {
        return stepsStore.getForDate(traineeId, date);
    }

    public boolean hasManualEntry(String traineeId, LocalDate date) throws IOException {
        return stepsStore.getForDate(traineeId, date).map(StepsEntry::isManual).orElse(false);
    }

    public List<StepsEntry> history(String traineeId) throws IOException {
        return stepsStore.getAll(traineeId);
    }

    public void delete(String entryId) throws IOException {
        stepsStore.delete(entryId);
    }
}
