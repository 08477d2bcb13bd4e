package com.bko.workouttracker.integrations.memory;

import com.bko.workouttracker.progress.Goal;
import com.bko.workouttracker.shared.AppSettings;
import com.bko.workouttracker.tracking.NutritionPlan;
import com.bko.workouttracker.workout.Training;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Component
public class SeedDataLoader implements ApplicationRunner {
    private static final Logger logger = LoggerFactory.getLogger(SeedDataLoader.class);

    private final AppSettings settings;
    private final ObjectMapper objectMapper;
    private final InMemoryTrainingStore trainingStore;
    private final InMemoryGoalStore goalStore;
    private final InMemoryNutritionStore nutritionStore;

    public SeedDataLoader(AppSettings settings,
                          ObjectMapper objectMapper,
                          InMemoryTrainingStore trainingStore,
                          InMemoryGoalStore goalStore,
                          InMemoryNutritionStore nutritionStore) {
        this.settings = settings;
        this.objectMapper = objectMapper;
        this.trainingStore = trainingStore;
        this.goalStore = goalStore;
        this.nutritionStore = nutritionStore;
    }

    @Override
    public void run(ApplicationArguments args) throws IOException {
        if (settings.workout() == null || !settings.workout().hasSeedFile()) {
            logger.info("No seed file configured, starting with empty stores.");
            return;
        }
        Path path = Path.of(settings.workout().seedFile());
        if (!Files.exists(path)) {
            logger.warn("Seed file {} not found, starting with empty stores.", path);
            return;
        }
        load(path);
    }

    SeedData load(Path path) throws IOException {
        SeedData data = objectMapper.readValue(path.toFile(), SeedData.class);
        for (Training training : data.trainings()) {
            trainingStore.upsert(training);
        }
        for (Goal goal : data.goals()) {
            goalStore.put(goal);
        }
        for (NutritionPlan plan : data.nutritionPlans()) {
            nutritionStore.putPlan(plan);
        }
        logger.info("Loaded {} trainings, {} goals and {} nutrition plans from {}",
                data.trainings().size(), data.goals().size(), data.nutritionPlans().size(), path);
        return data;
    }
}
