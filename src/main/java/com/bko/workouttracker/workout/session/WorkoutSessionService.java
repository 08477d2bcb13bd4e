package com.bko.workouttracker.workout.session;

import com.bko.workouttracker.workout.BulkSheet;
import com.bko.workouttracker.workout.HistoryStore;
import com.bko.workouttracker.workout.SessionOutcome;
import com.bko.workouttracker.workout.SessionView;
import com.bko.workouttracker.workout.SetInput;
import com.bko.workouttracker.workout.Training;
import com.bko.workouttracker.workout.TrainingNotFoundException;
import com.bko.workouttracker.workout.TrainingStore;
import com.bko.workouttracker.workout.WorkoutModeUseCase;
import com.bko.workouttracker.workout.WorkoutSessionUseCase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps one {@link WorkoutSession} per open training. Sessions end on completion or save-and-exit.
 */
@Service
public class WorkoutSessionService implements WorkoutSessionUseCase {
    private static final Logger logger = LoggerFactory.getLogger(WorkoutSessionService.class);

    private final TrainingStore trainingStore;
    private final HistoryStore historyStore;
    private final WorkoutModeUseCase workoutModeUseCase;
    private final Clock clock;
    private final SetValidator setValidator = new SetValidator();
    private final SessionModeResolver modeResolver = new SessionModeResolver();
    private final BulkSheetBuilder bulkSheetBuilder;
    private final Map<String, WorkoutSession> sessions = new ConcurrentHashMap<>();

    public WorkoutSessionService(TrainingStore trainingStore,
                                 HistoryStore historyStore,
                                 WorkoutModeUseCase workoutModeUseCase,
                                 Clock clock) {
        this.trainingStore = trainingStore;
        this.historyStore = historyStore;
        this.workoutModeUseCase = workoutModeUseCase;
        this.clock = clock;
        this.bulkSheetBuilder = new BulkSheetBuilder(new HistoryMatcher(historyStore));
    }

    @Override
    public List<Training> listTrainings(String traineeId) throws IOException {
        return trainingStore.getForTrainee(traineeId);
    }

    @Override
    public SessionView open(String trainingId) throws IOException {
        WorkoutSession existing = sessions.get(trainingId);
        WorkoutSession session;
        if (existing != null && existing.hasUnsavedChanges()) {
            session = existing;
        } else {
            try {
                session = newSession(load(trainingId));
                sessions.put(trainingId, session);
            } catch (IOException e) {
                if (existing == null) {
                    throw e;
                }
                logger.warn("Reloading training {} failed, using cached session: {}", trainingId, e.getMessage());
                session = existing;
            }
        }
        Training training = session.training();
        return new SessionView(training, modeResolver.resolveMode(training, workoutModeUseCase.preferredMode()), training.state());
    }

    @Override
    public SessionOutcome recordSet(String trainingId, String exerciseId, int setIndex, String reps, String weight, boolean deferSave)
            throws IOException {
        return session(trainingId).recordSet(exerciseId, setIndex, reps, weight, deferSave);
    }

    @Override
    public SessionOutcome saveBulk(String trainingId, Map<String, List<SetInput>> inputs) throws IOException {
        return session(trainingId).saveBulk(inputs, false);
    }

    @Override
    public BulkSheet bulkSheet(String trainingId) throws IOException {
        return bulkSheetBuilder.build(session(trainingId).training());
    }

    @Override
    public SessionOutcome complete(String trainingId) throws IOException {
        SessionOutcome outcome = session(trainingId).complete();
        if (outcome.status() == SessionOutcome.Status.SAVED) {
            sessions.remove(trainingId);
        }
        return outcome;
    }

    @Override
    public SessionOutcome saveAndExit(String trainingId) throws IOException {
        SessionOutcome outcome = session(trainingId).saveAndExit();
        if (outcome.status() == SessionOutcome.Status.SAVED) {
            sessions.remove(trainingId);
        }
        return outcome;
    }

    private WorkoutSession session(String trainingId) throws IOException {
        WorkoutSession existing = sessions.get(trainingId);
        if (existing != null) {
            return existing;
        }
        WorkoutSession created = newSession(load(trainingId));
        WorkoutSession raced = sessions.putIfAbsent(trainingId, created);
        return raced == null ? created : raced;
    }

    private WorkoutSession newSession(Training training) {
        return new WorkoutSession(training, trainingStore, historyStore, setValidator, clock);
    }

    private Training load(String trainingId) throws IOException {
        return trainingStore.findById(trainingId)
                .orElseThrow(() -> new TrainingNotFoundException(trainingId));
    }
}
