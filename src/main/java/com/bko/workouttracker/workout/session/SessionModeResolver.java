package com.bko.workouttracker.workout.session;

import com.bko.workouttracker.workout.Exercise;
import com.bko.workouttracker.workout.Training;
import com.bko.workouttracker.workout.WorkoutMode;

/**
 * Derives the logging mode of a training from its logged sets. The mode is never stored.
 */
public class SessionModeResolver {

    /**
     * First match wins:
     * <ol>
     *     <li>completed trainings are reviewed set by set</li>
     *     <li>any partially logged exercise means sets were entered one at a time</li>
     *     <li>otherwise any logged exercise means everything was entered at once</li>
     *     <li>nothing logged yet: the trainee's preference, {@link WorkoutMode#NORMAL} when unset</li>
     * </ol>
     * A training with one filled exercise and one untouched exercise resolves to {@link WorkoutMode#BULK}.
     */
    public WorkoutMode resolveMode(Training training, WorkoutMode preferredMode) {
        if (training.completed()) {
            return WorkoutMode.NORMAL;
        }
        if (training.exercises().stream().anyMatch(Exercise::isPartial)) {
            return WorkoutMode.NORMAL;
        }
        if (training.exercises().stream().anyMatch(Exercise::hasLoggedSets)) {
            return WorkoutMode.BULK;
        }
        return preferredMode == null ? WorkoutMode.NORMAL : preferredMode;
    }
}
