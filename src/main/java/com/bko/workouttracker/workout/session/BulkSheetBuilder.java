package com.bko.workouttracker.workout.session;

import com.bko.workouttracker.workout.ActualSet;
import com.bko.workouttracker.workout.BulkSheet;
import com.bko.workouttracker.workout.Exercise;
import com.bko.workouttracker.workout.HistoryRecord;
import com.bko.workouttracker.workout.SetInput;
import com.bko.workouttracker.workout.Training;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Pre-fills bulk entry: logged sets first, then the last performance of the same set, then the target weight.
 */
public class BulkSheetBuilder {
    private final HistoryMatcher historyMatcher;

    public BulkSheetBuilder(HistoryMatcher historyMatcher) {
        this.historyMatcher = historyMatcher;
    }

    public BulkSheet build(Training training) {
        List<String> names = training.exercises().stream().map(Exercise::name).toList();
        Map<String, HistoryRecord> history = historyMatcher.findLastPerformances(training.traineeId(), names);

        List<BulkSheet.ExerciseRows> exercises = new ArrayList<>();
        for (Exercise exercise : training.exercises()) {
            HistoryRecord last = history.get(exercise.name());
            List<SetInput> rows = new ArrayList<>(exercise.sets());
            for (int i = 0; i < exercise.sets(); i++) {
                rows.add(prefill(exercise, last, i));
            }
            exercises.add(new BulkSheet.ExerciseRows(exercise.id(), exercise.name(), last, rows));
        }
        return new BulkSheet(training.id(), exercises);
    }

    private SetInput prefill(Exercise exercise, HistoryRecord last, int setIndex) {
        if (setIndex < exercise.loggedSets()) {
            return toInput(exercise.actualSets().get(setIndex));
        }
        if (last != null && setIndex < last.sets().size()) {
            return toInput(last.sets().get(setIndex));
        }
        String weight = exercise.targetWeight() == null ? "" : String.valueOf(exercise.targetWeight());
        return new SetInput("", weight);
    }

    private SetInput toInput(ActualSet set) {
        return new SetInput(String.valueOf(set.reps()), String.valueOf(set.weight()));
    }
}
