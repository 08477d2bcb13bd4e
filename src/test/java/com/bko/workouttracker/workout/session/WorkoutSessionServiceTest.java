package com.bko.workouttracker.workout.session;

import com.bko.workouttracker.workout.HistoryStore;
import com.bko.workouttracker.workout.SessionOutcome;
import com.bko.workouttracker.workout.SessionState;
import com.bko.workouttracker.workout.SessionView;
import com.bko.workouttracker.workout.Training;
import com.bko.workouttracker.workout.TrainingNotFoundException;
import com.bko.workouttracker.workout.TrainingStore;
import com.bko.workouttracker.workout.WorkoutMode;
import com.bko.workouttracker.workout.WorkoutModeUseCase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static com.bko.workouttracker.workout.TrainingFixtures.exercise;
import static com.bko.workouttracker.workout.TrainingFixtures.training;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WorkoutSessionServiceTest {

    private TrainingStore trainingStore;
    private HistoryStore historyStore;
    private WorkoutModeUseCase modeUseCase;
    private WorkoutSessionService service;

    @BeforeEach
    void setUp() throws IOException {
        trainingStore = mock(TrainingStore.class);
        historyStore = mock(HistoryStore.class);
        modeUseCase = mock(WorkoutModeUseCase.class);
        when(modeUseCase.preferredMode()).thenReturn(WorkoutMode.BULK);
        when(trainingStore.upsert(any(Training.class))).thenAnswer(invocation -> invocation.getArgument(0));
        service = new WorkoutSessionService(trainingStore, historyStore, modeUseCase,
                Clock.fixed(Instant.parse("2024-01-10T10:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void openResolvesModeFromTrainingAndPreference() throws IOException {
        when(trainingStore.findById("fresh")).thenReturn(Optional.of(training("fresh", exercise("e1", "Squat", 3))));
        when(trainingStore.findById("partial")).thenReturn(Optional.of(training("partial", exercise("e1", "Squat", 3, 5))));

        SessionView fresh = service.open("fresh");
        SessionView partial = service.open("partial");

        assertEquals(WorkoutMode.BULK, fresh.mode());
        assertEquals(SessionState.NOT_STARTED, fresh.state());
        assertEquals(WorkoutMode.NORMAL, partial.mode());
        assertEquals(SessionState.IN_PROGRESS, partial.state());
    }

    @Test
    void missingTrainingIsNotFound() throws IOException {
        when(trainingStore.findById("missing")).thenReturn(Optional.empty());

        assertThrows(TrainingNotFoundException.class, () -> service.open("missing"));
        assertThrows(TrainingNotFoundException.class, () -> service.complete("missing"));
    }

    @Test
    void unsavedSessionSurvivesReopen() throws IOException {
        when(trainingStore.findById("t1")).thenReturn(Optional.of(training("t1", exercise("e1", "Squat", 2))));

        service.open("t1");
        service.recordSet("t1", "e1", 0, "5", "100", true);
        SessionView reopened = service.open("t1");

        assertEquals(1, reopened.training().exercises().get(0).loggedSets());
        verify(trainingStore, times(1)).findById("t1");
    }

    @Test
    void reloadFailureFallsBackToCachedSession() throws IOException {
        when(trainingStore.findById("t1"))
                .thenReturn(Optional.of(training("t1", exercise("e1", "Squat", 2, 5))))
                .thenThrow(new IOException("offline"));

        service.open("t1");
        SessionView again = service.open("t1");

        assertEquals("t1", again.training().id());
        assertEquals(1, again.training().exercises().get(0).loggedSets());
    }

    @Test
    void completingEndsTheSession() throws IOException {
        when(trainingStore.findById("t1"))
                .thenReturn(Optional.of(training("t1", exercise("e1", "Squat", 1))));

        assertEquals(SessionOutcome.Status.SAVED, service.recordSet("t1", "e1", 0, "5", "100", false).status());
        SessionOutcome outcome = service.complete("t1");

        assertTrue(outcome.training().completed());
        verify(historyStore).save(outcome.training());
        service.bulkSheet("t1");
        verify(trainingStore, times(2)).findById("t1");
    }
}
