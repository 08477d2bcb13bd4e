package com.bko.workouttracker.progress.app;

import com.bko.workouttracker.progress.CalorieBalance;
import com.bko.workouttracker.progress.Goal;
import com.bko.workouttracker.progress.GoalProgress;
import com.bko.workouttracker.progress.GoalType;
import com.bko.workouttracker.progress.MetricDelta;
import com.bko.workouttracker.progress.TrainingProgress;
import com.bko.workouttracker.progress.WeeklyAverage;
import com.bko.workouttracker.tracking.Measurement;
import com.bko.workouttracker.tracking.StepsEntry;
import com.bko.workouttracker.tracking.StepsOrigin;
import com.bko.workouttracker.workout.Training;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static com.bko.workouttracker.workout.TrainingFixtures.exercise;
import static com.bko.workouttracker.workout.TrainingFixtures.training;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProgressCalculatorTest {

    // Wednesday
    private static final LocalDate TODAY = LocalDate.of(2024, 1, 10);
    private static final LocalDate MONDAY = LocalDate.of(2024, 1, 8);
    private static final LocalDate SUNDAY = LocalDate.of(2024, 1, 7);
    private static final LocalDate TUESDAY = LocalDate.of(2024, 1, 9);

    private final ProgressCalculator calculator = new ProgressCalculator();

    private static Measurement measurement(LocalDate date, double weight, Map<String, Double> body) {
        return new Measurement(date.toString(), "trainee-1", date, weight, body);
    }

    private static Goal goal(double current, double target) {
        return new Goal("g1", "trainee-1", GoalType.WEIGHT, "Reach 75kg", current, target, "kg", TODAY.plusDays(1), false);
    }

    @Test
    void trainingProgressCountsLoggedAgainstPrescribedSets() {
        Training training = training("t1", exercise("e1", "Bench", 3, 10, 10), exercise("e2", "Row", 2, 8));

        TrainingProgress progress = calculator.trainingProgress(training);

        assertEquals("3/5 sets", progress.setsLabel());
        assertEquals("60%", progress.percentLabel());
        assertEquals(0.6, progress.ratio(), 1e-9);
    }

    @Test
    void emptyTrainingIsZeroOfZero() {
        TrainingProgress progress = calculator.trainingProgress(training("t1"));

        assertEquals("0/0 sets", progress.setsLabel());
        assertEquals("0%", progress.percentLabel());
        assertEquals(0.0, progress.ratio());
    }

    @Test
    void mondayOfWeek() {
        assertEquals(MONDAY, calculator.mondayOf(TODAY));
        assertEquals(MONDAY, calculator.mondayOf(MONDAY));
        assertEquals(LocalDate.of(2024, 1, 1), calculator.mondayOf(SUNDAY));
    }

    @Test
    void weeklyAverageIgnoresLastWeek() {
        List<Measurement> measurements = List.of(
                measurement(SUNDAY, 80.0, Map.of()),
                measurement(TUESDAY, 78.0, Map.of()));

        WeeklyAverage average = calculator.weeklyWeightAverage(measurements, TODAY).orElseThrow();

        assertEquals(78.0, average.average(), 1e-9);
        assertEquals(1, average.count());
    }

    @Test
    void weeklyAverageIsEmptyWithoutEntriesThisWeek() {
        assertTrue(calculator.weeklyWeightAverage(List.of(measurement(SUNDAY, 80.0, null)), TODAY).isEmpty());
        assertTrue(calculator.weeklyStepsAverage(List.of(), TODAY).isEmpty());
    }

    @Test
    void weeklyStepsAverageIncludesMondayAndToday() {
        List<StepsEntry> steps = List.of(
                new StepsEntry("s1", "trainee-1", MONDAY, 6000, StepsOrigin.MANUAL),
                new StepsEntry("s2", "trainee-1", TODAY, 10000, StepsOrigin.DEVICE_SYNC),
                new StepsEntry("s3", "trainee-1", TODAY.plusDays(1), 50000, StepsOrigin.MANUAL));

        WeeklyAverage average = calculator.weeklyStepsAverage(steps, TODAY).orElseThrow();

        assertEquals(8000.0, average.average(), 1e-9);
        assertEquals(2, average.count());
    }

    @Test
    void bodyAveragesOnlyCountEntriesWithTheDimension() {
        List<Measurement> measurements = List.of(
                measurement(MONDAY, 80.0, Map.of("waist", 84.0, "arms", 35.0)),
                measurement(TUESDAY, 79.5, Map.of("waist", 82.0)),
                measurement(SUNDAY, 81.0, Map.of("chest", 100.0)));

        Map<String, WeeklyAverage> averages = calculator.weeklyBodyAverages(measurements, TODAY);

        assertEquals(2, averages.size());
        assertEquals(new WeeklyAverage(83.0, 2), averages.get("waist"));
        assertEquals(new WeeklyAverage(35.0, 1), averages.get("arms"));
    }

    @Test
    void goalPercentageIsClamped() {
        assertEquals(50.0, calculator.goalPercentage(goal(40, 80)), 1e-9);
        assertEquals(100.0, calculator.goalPercentage(goal(120, 80)), 1e-9);
        assertEquals(0.0, calculator.goalPercentage(goal(-10, 80)), 1e-9);
        assertEquals(0.0, calculator.goalPercentage(goal(10, 0)), 1e-9);
    }

    @Test
    void goalProgressLabels() {
        GoalProgress progress = calculator.goalProgress(goal(2, 3), TODAY);

        assertEquals("67%", progress.label());
        assertEquals("2024-01-11", progress.deadlineLabel());
        assertFalse(progress.completed());
    }

    @Test
    void calorieBalanceReportsOvershoot() {
        CalorieBalance under = calculator.calorieBalance(2000, 1500);
        CalorieBalance over = calculator.calorieBalance(2000, 2300);

        assertEquals(500, under.remaining());
        assertFalse(under.isOver());
        assertEquals(-300, over.remaining());
        assertTrue(over.isOver());
        assertEquals(300, over.magnitude());
    }

    @Test
    void weightDeltasAreChronological() {
        List<MetricDelta> rows = calculator.weightDeltas(List.of(
                measurement(TODAY, 79.0, null),
                measurement(SUNDAY, 80.0, null),
                measurement(TUESDAY, 79.5, null)), TODAY);

        assertEquals(3, rows.size());
        assertEquals(SUNDAY, rows.get(0).date());
        assertNull(rows.get(0).delta());
        assertEquals(-0.5, rows.get(1).delta(), 1e-9);
        assertEquals("Yesterday", rows.get(1).dateLabel());
        assertEquals(-0.5, rows.get(2).delta(), 1e-9);
        assertEquals("Today", rows.get(2).dateLabel());
    }

    @Test
    void countsCompletedTrainings() {
        Training done = training("t1").markCompleted(Instant.parse("2024-01-09T10:00:00Z"));

        assertEquals(1, calculator.completedTrainings(List.of(done, training("t2"))));
    }
}
