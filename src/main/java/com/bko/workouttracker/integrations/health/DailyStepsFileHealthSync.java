package com.bko.workouttracker.integrations.health;

import com.bko.workouttracker.shared.AppSettings;
import com.bko.workouttracker.tracking.HealthSync;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Map;

/**
 * Reads step counts exported by the trainee's device as {@code {"2024-01-05": 8432, ...}}.
 */
@Component
public class DailyStepsFileHealthSync implements HealthSync {
    private static final Logger logger = LoggerFactory.getLogger(DailyStepsFileHealthSync.class);
    private static final TypeReference<Map<String, Integer>> STEPS_TYPE = new TypeReference<>() {};

    private final AppSettings settings;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public DailyStepsFileHealthSync(AppSettings settings, ObjectMapper objectMapper, Clock clock) {
        this.settings = settings;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public boolean isAvailable() {
        return settings.isHealthSyncConfigured() && Files.isReadable(stepsFile());
    }

    @Override
    public int getTodaySteps() throws IOException {
        if (!isAvailable()) {
            logger.debug("Health sync not configured, reporting 0 steps.");
            return 0;
        }
        Map<String, Integer> daily = objectMapper.readValue(stepsFile().toFile(), STEPS_TYPE);
        Integer steps = daily.get(LocalDate.now(clock).toString());
        return steps == null || steps < 0 ? 0 : steps;
    }

    private Path stepsFile() {
        return Path.of(settings.healthSync().dailyStepsFile());
    }
}
