package com.bko.workouttracker.integrations.health;

import com.bko.workouttracker.shared.AppSettings;
import com.bko.workouttracker.shared.HealthSyncSettings;
import com.bko.workouttracker.shared.WorkoutSettings;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DailyStepsFileHealthSyncTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-01-10T10:00:00Z"), ZoneOffset.UTC);

    private DailyStepsFileHealthSync sync(boolean enabled, Path file) {
        AppSettings settings = new AppSettings(new WorkoutSettings(null, null, null),
                new HealthSyncSettings(enabled, file == null ? null : file.toString()));
        return new DailyStepsFileHealthSync(settings, new ObjectMapper(), clock);
    }

    @Test
    void readsTodaysCount(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("steps.json");
        Files.writeString(file, "{\"2024-01-09\": 4000, \"2024-01-10\": 8432}");

        DailyStepsFileHealthSync sync = sync(true, file);

        assertTrue(sync.isAvailable());
        assertEquals(8432, sync.getTodaySteps());
    }

    @Test
    void missingDayOrNegativeCountIsZero(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("steps.json");
        Files.writeString(file, "{\"2024-01-09\": 4000}");
        assertEquals(0, sync(true, file).getTodaySteps());

        Files.writeString(file, "{\"2024-01-10\": -5}");
        assertEquals(0, sync(true, file).getTodaySteps());
    }

    @Test
    void unavailableWhenDisabledOrFileMissing(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("steps.json");
        Files.writeString(file, "{\"2024-01-10\": 100}");

        assertFalse(sync(false, file).isAvailable());
        assertEquals(0, sync(false, file).getTodaySteps());
        assertFalse(sync(true, dir.resolve("absent.json")).isAvailable());
        assertFalse(sync(true, null).isAvailable());
    }
}
