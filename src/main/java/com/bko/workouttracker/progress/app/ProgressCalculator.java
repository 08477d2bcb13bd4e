package com.bko.workouttracker.progress.app;

import com.bko.workouttracker.progress.CalorieBalance;
import com.bko.workouttracker.progress.Goal;
import com.bko.workouttracker.progress.GoalProgress;
import com.bko.workouttracker.progress.MetricDelta;
import com.bko.workouttracker.progress.TrainingProgress;
import com.bko.workouttracker.progress.WeeklyAverage;
import com.bko.workouttracker.shared.DateLabels;
import com.bko.workouttracker.tracking.Measurement;
import com.bko.workouttracker.tracking.StepsEntry;
import com.bko.workouttracker.workout.Exercise;
import com.bko.workouttracker.workout.Training;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.function.ToDoubleFunction;

/**
 * Derived progress figures over already loaded data. No I/O; {@code today} is always passed in.
 */
@Component
public class ProgressCalculator {

    public TrainingProgress trainingProgress(Training training) {
        int completed = 0;
        int total = 0;
        for (Exercise exercise : training.exercises()) {
            completed += exercise.loggedSets();
            total += exercise.sets();
        }
        return new TrainingProgress(completed, total);
    }

    public TrainingProgress exerciseProgress(Exercise exercise) {
        return new TrainingProgress(exercise.loggedSets(), exercise.sets());
    }

    /**
     * The goal's own percentage clamped to [0, 100].
     */
    public double goalPercentage(Goal goal) {
        double percentage = goal.progressPercentage();
        if (Double.isNaN(percentage)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(100.0, percentage));
    }

    public GoalProgress goalProgress(Goal goal, LocalDate today) {
        double percentage = goalPercentage(goal);
        return new GoalProgress(
                goal.id(),
                goal.name(),
                goal.type(),
                percentage,
                Math.round(percentage) + "%",
                DateLabels.format(goal.deadline(), today),
                goal.completed()
        );
    }

    public LocalDate mondayOf(LocalDate today) {
        return today.minusDays(today.getDayOfWeek().getValue() - DayOfWeek.MONDAY.getValue());
    }

    /**
     * Mean of the values dated from Monday of the current week through {@code today}, both inclusive.
     * Empty when nothing falls inside the window.
     */
    public <T> Optional<WeeklyAverage> weeklyAverage(Collection<T> entries,
                                                     Function<T, LocalDate> dateOf,
                                                     ToDoubleFunction<T> valueOf,
                                                     LocalDate today) {
        LocalDate monday = mondayOf(today);
        double sum = 0;
        int count = 0;
        for (T entry : entries) {
            LocalDate date = dateOf.apply(entry);
            if (date == null || date.isBefore(monday) || date.isAfter(today)) {
                continue;
            }
            sum += valueOf.applyAsDouble(entry);
            count++;
        }
        return count == 0 ? Optional.empty() : Optional.of(new WeeklyAverage(sum / count, count));
    }

    public Optional<WeeklyAverage> weeklyWeightAverage(Collection<Measurement> measurements, LocalDate today) {
        return weeklyAverage(measurements, Measurement::date, Measurement::weight, today);
    }

    public Optional<WeeklyAverage> weeklyStepsAverage(Collection<StepsEntry> entries, LocalDate today) {
        return weeklyAverage(entries, StepsEntry::date, StepsEntry::steps, today);
    }

    /**
     * Weekly average per body dimension. Each dimension only counts the entries that recorded it.
     */
    public Map<String, WeeklyAverage> weeklyBodyAverages(Collection<Measurement> measurements, LocalDate today) {
        Map<String, List<Measurement>> byDimension = new TreeMap<>();
        for (Measurement measurement : measurements) {
            for (String dimension : measurement.bodyMeasurements().keySet()) {
                byDimension.computeIfAbsent(dimension, key -> new ArrayList<>()).add(measurement);
            }
        }
        Map<String, WeeklyAverage> averages = new LinkedHashMap<>();
        byDimension.forEach((dimension, entries) ->
                weeklyAverage(entries, Measurement::date, m -> m.bodyMeasurements().get(dimension), today)
                        .ifPresent(average -> averages.put(dimension, average)));
        return averages;
    }

    public CalorieBalance calorieBalance(int dailyTarget, int consumedTotal) {
        return new CalorieBalance(dailyTarget, consumedTotal);
    }

    /**
     * Sorts by date, oldest first, and compares every entry with the one before it.
     */
    public <T> List<MetricDelta> deltas(Collection<T> entries,
                                        Function<T, LocalDate> dateOf,
                                        ToDoubleFunction<T> valueOf,
                                        LocalDate today) {
        List<T> sorted = entries.stream()
                .filter(entry -> dateOf.apply(entry) != null)
                .sorted(Comparator.comparing(dateOf))
                .toList();
        List<MetricDelta> rows = new ArrayList<>(sorted.size());
        Double previous = null;
        for (T entry : sorted) {
            LocalDate date = dateOf.apply(entry);
            double value = valueOf.applyAsDouble(entry);
            Double delta = previous == null ? null : value - previous;
            rows.add(new MetricDelta(date, DateLabels.format(date, today), value, delta));
            previous = value;
        }
        return rows;
    }

    public List<MetricDelta> weightDeltas(Collection<Measurement> measurements, LocalDate today) {
        return deltas(measurements, Measurement::date, Measurement::weight, today);
    }

    public int completedTrainings(Collection<Training> trainings) {
        return (int) trainings.stream().filter(Objects::nonNull).filter(Training::completed).count();
    }
}
