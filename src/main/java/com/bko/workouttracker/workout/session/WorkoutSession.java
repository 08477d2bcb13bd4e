package com.bko.workouttracker.workout.session;

import com.bko.workouttracker.workout.ActualSet;
import com.bko.workouttracker.workout.Exercise;
import com.bko.workouttracker.workout.HistoryStore;
import com.bko.workouttracker.workout.SessionOutcome;
import com.bko.workouttracker.workout.SessionState;
import com.bko.workouttracker.workout.SetInput;
import com.bko.workouttracker.workout.SetIssue;
import com.bko.workouttracker.workout.SetValidationError;
import com.bko.workouttracker.workout.SetValidationResult;
import com.bko.workouttracker.workout.Training;
import com.bko.workouttracker.workout.TrainingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Logging session for a single training: NOT_STARTED, IN_PROGRESS, COMPLETED.
 * <p>
 * Every accepted edit is saved through the {@link TrainingStore} unless the caller defers it. When a store write
 * fails the session keeps the last saved training. Calls are serialized on the session, so edits apply in the
 * order they were issued.
 * <p>
 * A completed training stays completed: an edit must leave every prescribed set logged and valid, and is then
 * re-submitted right away with a new completion time and rewritten history. Such edits are never deferred.
 */
public class WorkoutSession {
    private static final Logger logger = LoggerFactory.getLogger(WorkoutSession.class);

    private final TrainingStore trainingStore;
    private final HistoryStore historyStore;
    private final SetValidator setValidator;
    private final Clock clock;

    private Training training;
    private Training lastSaved;

    public WorkoutSession(Training training,
                          TrainingStore trainingStore,
                          HistoryStore historyStore,
                          SetValidator setValidator,
                          Clock clock) {
        this.training = training;
        this.lastSaved = training;
        this.trainingStore = trainingStore;
        this.historyStore = historyStore;
        this.setValidator = setValidator;
        this.clock = clock;
    }

    public synchronized Training training() {
        return training;
    }

    public synchronized SessionState state() {
        return training.state();
    }

    public synchronized boolean hasUnsavedChanges() {
        return !training.equals(lastSaved);
    }

    public SessionOutcome recordSet(String exerciseId, int setIndex, String reps, String weight) {
        return recordSet(exerciseId, setIndex, reps, weight, false);
    }

    /**
     * Replaces the set at {@code setIndex} or appends it when it is the next one.
     * A set with a blank field is not entered and leaves the training unchanged.
     */
    public synchronized SessionOutcome recordSet(String exerciseId, int setIndex, String reps, String weight, boolean deferSave) {
        Optional<Exercise> found = training.findExercise(exerciseId);
        if (found.isEmpty()) {
            return SessionOutcome.invalid(training, List.of(
                    new SetIssue(exerciseId, null, setIndex, SetValidationError.UNKNOWN_EXERCISE)));
        }
        Exercise exercise = found.get();
        if (setIndex < 0 || setIndex >= exercise.sets()) {
            return SessionOutcome.invalid(training, List.of(issue(exercise, setIndex, SetValidationError.SET_OUT_OF_RANGE)));
        }
        if (setIndex > exercise.loggedSets()) {
            return SessionOutcome.invalid(training, List.of(issue(exercise, setIndex, SetValidationError.OUT_OF_ORDER_SET)));
        }

        SetValidationResult result = setValidator.validate(reps, weight);
        if (result.isNotEntered()) {
            return SessionOutcome.ignored(training);
        }
        if (!result.isValid()) {
            return SessionOutcome.invalid(training, List.of(issue(exercise, setIndex, result.error())));
        }

        Training updated = training.withExercise(exercise.withSet(setIndex, result.set()));
        if (training.completed()) {
            return resubmit(updated);
        }
        if (deferSave) {
            training = updated;
            return SessionOutcome.saved(training, List.of("Set recorded, not saved yet."));
        }
        return persist(updated, "Set " + (setIndex + 1) + " of " + exercise.name() + " saved.");
    }

    /**
     * Takes every set of every exercise at once. Rows that do not validate are skipped and the valid rows are kept
     * in order without gaps. Exercises missing from {@code inputs} keep their logged sets.
     */
    public synchronized SessionOutcome saveBulk(Map<String, List<SetInput>> inputs, boolean deferSave) {
        List<Exercise> updatedExercises = new ArrayList<>(training.exercises().size());
        int skipped = 0;
        for (Exercise exercise : training.exercises()) {
            List<SetInput> rows = inputs.get(exercise.id());
            if (rows == null) {
                updatedExercises.add(exercise);
                continue;
            }
            List<ActualSet> actualSets = new ArrayList<>();
            for (int i = 0; i < rows.size() && i < exercise.sets(); i++) {
                SetInput row = rows.get(i);
                SetValidationResult result = row == null
                        ? SetValidationResult.invalid(SetValidationError.EMPTY_FIELD)
                        : setValidator.validate(row.reps(), row.weight());
                if (result.isValid()) {
                    actualSets.add(result.set());
                } else if (!result.isNotEntered()) {
                    skipped++;
                }
            }
            updatedExercises.add(exercise.withActualSets(actualSets));
        }

        Training updated = training.withExercises(updatedExercises);
        if (training.completed()) {
            return resubmit(updated);
        }
        String message = skipped == 0
                ? "Workout progress saved."
                : "Workout progress saved, " + skipped + " invalid sets skipped.";
        if (deferSave) {
            training = updated;
            return SessionOutcome.saved(training, List.of(message));
        }
        return persist(updated, message);
    }

    /**
     * Marks the training completed once every prescribed set is logged and valid. On failure every missing or
     * invalid set is reported. Completing an already completed training re-submits it with a new timestamp.
     */
    public synchronized SessionOutcome complete() {
        List<SetIssue> issues = completionIssues(training);
        if (!issues.isEmpty()) {
            return SessionOutcome.invalid(training, issues);
        }
        return submitCompleted(training, "Workout completed.");
    }

    /**
     * Saves the current state whether or not it is complete.
     */
    public synchronized SessionOutcome saveAndExit() {
        return persist(training, "Workout progress saved.");
    }

    List<SetIssue> completionIssues(Training candidate) {
        List<SetIssue> issues = new ArrayList<>();
        for (Exercise exercise : candidate.exercises()) {
            List<ActualSet> logged = exercise.actualSets();
            for (int i = 0; i < exercise.sets(); i++) {
                if (i >= logged.size()) {
                    issues.add(issue(exercise, i, SetValidationError.EMPTY_FIELD));
                    continue;
                }
                SetValidationResult result = setValidator.validate(logged.get(i));
                if (!result.isValid()) {
                    issues.add(issue(exercise, i, result.error()));
                }
            }
            for (int i = exercise.sets(); i < logged.size(); i++) {
                issues.add(issue(exercise, i, SetValidationError.SET_OUT_OF_RANGE));
            }
        }
        return issues;
    }

    // Edits to a completed training are all-or-nothing.
    private SessionOutcome resubmit(Training candidate) {
        List<SetIssue> issues = completionIssues(candidate);
        if (!issues.isEmpty()) {
            return SessionOutcome.invalid(training, issues);
        }
        return submitCompleted(candidate, "Completed workout updated.");
    }

    private SessionOutcome submitCompleted(Training candidate, String message) {
        Training completed = candidate.markCompleted(Instant.now(clock));
        SessionOutcome outcome = persist(completed, message);
        if (outcome.status() != SessionOutcome.Status.SAVED) {
            return outcome;
        }
        logger.info("Training {} completed by trainee {}", completed.id(), completed.traineeId());

        List<String> messages = new ArrayList<>(outcome.messages());
        try {
            historyStore.save(training);
        } catch (Exception e) {
            logger.warn("Could not save exercise history for training {}", training.id(), e);
            messages.add("WARN: Exercise history not saved: " + e.getMessage());
        }
        return SessionOutcome.saved(training, messages);
    }

    private SessionOutcome persist(Training candidate, String message) {
        try {
            Training saved = trainingStore.upsert(candidate);
            training = saved == null ? candidate : saved;
            lastSaved = training;
            return SessionOutcome.saved(training, List.of(message));
        } catch (Exception e) {
            logger.warn("Saving training {} failed, keeping last saved state", candidate.id(), e);
            training = lastSaved;
            return SessionOutcome.storeFailed(training, "Could not save workout: " + e.getMessage());
        }
    }

    private static SetIssue issue(Exercise exercise, int setIndex, SetValidationError error) {
        return new SetIssue(exercise.id(), exercise.name(), setIndex, error);
    }
}
