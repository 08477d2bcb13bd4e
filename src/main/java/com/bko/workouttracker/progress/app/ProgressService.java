package com.bko.workouttracker.progress.app;

import com.bko.workouttracker.progress.CalorieBalance;
import com.bko.workouttracker.progress.Goal;
import com.bko.workouttracker.progress.GoalProgress;
import com.bko.workouttracker.progress.GoalStore;
import com.bko.workouttracker.progress.MetricDelta;
import com.bko.workouttracker.progress.ProgressSnapshot;
import com.bko.workouttracker.progress.ProgressUseCase;
import com.bko.workouttracker.progress.TrainingOverview;
import com.bko.workouttracker.progress.WeeklyAverage;
import com.bko.workouttracker.shared.DateLabels;
import com.bko.workouttracker.tracking.Measurement;
import com.bko.workouttracker.tracking.MeasurementStore;
import com.bko.workouttracker.tracking.NutritionEntry;
import com.bko.workouttracker.tracking.NutritionPlan;
import com.bko.workouttracker.tracking.NutritionStore;
import com.bko.workouttracker.tracking.StepsEntry;
import com.bko.workouttracker.tracking.StepsStore;
import com.bko.workouttracker.workout.Training;
import com.bko.workouttracker.workout.TrainingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class ProgressService implements ProgressUseCase {
    private static final Logger logger = LoggerFactory.getLogger(ProgressService.class);

    private final TrainingStore trainingStore;
    private final GoalStore goalStore;
    private final MeasurementStore measurementStore;
    private final StepsStore stepsStore;
    private final NutritionStore nutritionStore;
    private final ProgressCalculator calculator;
    private final Clock clock;

    public ProgressService(TrainingStore trainingStore,
                           GoalStore goalStore,
                           MeasurementStore measurementStore,
                           StepsStore stepsStore,
                           NutritionStore nutritionStore,
                           ProgressCalculator calculator,
                           Clock clock) {
        this.trainingStore = trainingStore;
        this.goalStore = goalStore;
        this.measurementStore = measurementStore;
        this.stepsStore = stepsStore;
        this.nutritionStore = nutritionStore;
        this.calculator = calculator;
        this.clock = clock;
    }

    @Override
    public ProgressSnapshot loadProgress(String traineeId) {
        LocalDate today = LocalDate.now(clock);
        List<String> messages = new ArrayList<>();

        List<TrainingOverview> trainings = List.of();
        int completedTrainings = 0;
        try {
            List<Training> loaded = trainingStore.getForTrainee(traineeId).stream()
                    .sorted(Comparator.comparing(Training::scheduledDate, Comparator.nullsLast(Comparator.naturalOrder())))
                    .toList();
            trainings = loaded.stream().map(training -> toOverview(training, today)).toList();
            completedTrainings = calculator.completedTrainings(loaded);
        } catch (Exception e) {
            logger.warn("Failed to load trainings for {}", traineeId, e);
            messages.add("Could not load trainings: " + e.getMessage());
        }

        List<GoalProgress> goals = List.of();
        try {
            List<Goal> loaded = goalStore.getForTrainee(traineeId);
            goals = loaded.stream().map(goal -> calculator.goalProgress(goal, today)).toList();
        } catch (Exception e) {
            logger.warn("Failed to load goals for {}", traineeId, e);
            messages.add("Could not load goals: " + e.getMessage());
        }

        WeeklyAverage weeklyWeight = null;
        Map<String, WeeklyAverage> weeklyBody = Map.of();
        List<MetricDelta> weightHistory = List.of();
        try {
            List<Measurement> measurements = measurementStore.getForTrainee(traineeId);
            weeklyWeight = calculator.weeklyWeightAverage(measurements, today).orElse(null);
            weeklyBody = calculator.weeklyBodyAverages(measurements, today);
            weightHistory = calculator.weightDeltas(measurements, today);
            if (weeklyWeight == null) {
                messages.add("No measurements recorded this week.");
            }
        } catch (Exception e) {
            logger.warn("Failed to load measurements for {}", traineeId, e);
            messages.add("Could not load measurements: " + e.getMessage());
        }

        WeeklyAverage weeklySteps = null;
        try {
            List<StepsEntry> steps = stepsStore.getAll(traineeId);
            weeklySteps = calculator.weeklyStepsAverage(steps, today).orElse(null);
        } catch (Exception e) {
            logger.warn("Failed to load steps for {}", traineeId, e);
            messages.add("Could not load steps: " + e.getMessage());
        }

        CalorieBalance calories = null;
        try {
            Optional<NutritionPlan> plan = nutritionStore.getPlan(traineeId);
            if (plan.isPresent()) {
                int consumed = nutritionStore.getEntry(traineeId, today)
                        .map(NutritionEntry::totalCalories)
                        .orElse(0);
                calories = calculator.calorieBalance(plan.get().dailyCalories(), consumed);
            } else {
                messages.add("No nutrition plan assigned.");
            }
        } catch (Exception e) {
            logger.warn("Failed to load nutrition for {}", traineeId, e);
            messages.add("Could not load nutrition: " + e.getMessage());
        }

        return new ProgressSnapshot(
                traineeId,
                today,
                List.copyOf(messages),
                trainings,
                completedTrainings,
                goals,
                weeklyWeight,
                weeklyBody,
                weeklySteps,
                weightHistory,
                calories
        );
    }

    private TrainingOverview toOverview(Training training, LocalDate today) {
        return new TrainingOverview(
                training.id(),
                training.name(),
                DateLabels.format(training.scheduledDate(), today),
                training.completed(),
                calculator.trainingProgress(training)
        );
    }
}
