package com.bko.workouttracker.workout;

import java.io.IOException;
import java.util.List;
import java.util.Map;

public interface WorkoutSessionUseCase {
    List<Training> listTrainings(String traineeId) throws IOException;

    SessionView open(String trainingId) throws IOException;

    SessionOutcome recordSet(String trainingId, String exerciseId, int setIndex, String reps, String weight, boolean deferSave)
            throws IOException;

    SessionOutcome saveBulk(String trainingId, Map<String, List<SetInput>> inputs) throws IOException;

    BulkSheet bulkSheet(String trainingId) throws IOException;

    SessionOutcome complete(String trainingId) throws IOException;

    SessionOutcome saveAndExit(String trainingId) throws IOException;
}
