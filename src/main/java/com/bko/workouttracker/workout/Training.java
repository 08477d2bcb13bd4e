package com.bko.workouttracker.workout;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A workout assigned to a trainee. Trainings are authored elsewhere; this application only changes the logged sets
 * and the completion fields.
 */
public record Training(
        String id,
        String traineeId,
        String name,
        String description,
        Difficulty difficulty,
        LocalDate scheduledDate,
        List<Exercise> exercises,
        String notes,
        boolean completed,
        Instant completedAt
) {
    public Training {
        description = description == null ? "" : description;
        exercises = exercises == null ? List.of() : List.copyOf(exercises);
    }

    public Optional<Exercise> findExercise(String exerciseId) {
        return exercises.stream()
                .filter(exercise -> exercise.id() != null && exercise.id().equals(exerciseId))
                .findFirst();
    }

    public Training withExercises(List<Exercise> updated) {
        return new Training(id, traineeId, name, description, difficulty, scheduledDate, updated, notes, completed, completedAt);
    }

    public Training withExercise(Exercise updated) {
        List<Exercise> replaced = new ArrayList<>(exercises.size());
        for (Exercise exercise : exercises) {
            replaced.add(exercise.id() != null && exercise.id().equals(updated.id()) ? updated : exercise);
        }
        return withExercises(replaced);
    }

    public Training markCompleted(Instant at) {
        return new Training(id, traineeId, name, description, difficulty, scheduledDate, exercises, notes, true, at);
    }

    public SessionState state() {
        return SessionState.of(this);
    }
}
