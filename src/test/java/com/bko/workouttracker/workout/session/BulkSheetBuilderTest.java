package com.bko.workouttracker.workout.session;

import com.bko.workouttracker.workout.ActualSet;
import com.bko.workouttracker.workout.BulkSheet;
import com.bko.workouttracker.workout.Exercise;
import com.bko.workouttracker.workout.HistoryRecord;
import com.bko.workouttracker.workout.HistoryStore;
import com.bko.workouttracker.workout.SetInput;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.bko.workouttracker.workout.TrainingFixtures.exercise;
import static com.bko.workouttracker.workout.TrainingFixtures.training;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class BulkSheetBuilderTest {

    @Test
    void prefersLoggedSetsThenHistoryThenTargetWeight() throws Exception {
        HistoryStore historyStore = mock(HistoryStore.class);
        HistoryRecord lastBench = new HistoryRecord("h1", "trainee-1", "t0", "Bench Press",
                Instant.parse("2024-01-03T10:00:00Z"),
                List.of(new ActualSet(8, 60.0), new ActualSet(7, 60.0)), null);
        when(historyStore.getLast(anyString(), anyString())).thenReturn(Optional.empty());
        when(historyStore.getLast("trainee-1", "Bench Press")).thenReturn(Optional.of(lastBench));

        Exercise bench = exercise("e1", "Bench Press", 3, 10);
        Exercise curl = new Exercise("e2", "Curl", 2, 12, null, "", List.of());
        BulkSheet sheet = new BulkSheetBuilder(new HistoryMatcher(historyStore))
                .build(training("t1", bench, curl));

        assertEquals("t1", sheet.trainingId());
        BulkSheet.ExerciseRows benchRows = sheet.exercises().get(0);
        assertEquals(lastBench, benchRows.lastPerformance());
        assertEquals(List.of(
                new SetInput("10", "50.0"),
                new SetInput("7", "60.0"),
                new SetInput("", "50.0")), benchRows.rows());

        BulkSheet.ExerciseRows curlRows = sheet.exercises().get(1);
        assertNull(curlRows.lastPerformance());
        assertEquals(List.of(new SetInput("", ""), new SetInput("", "")), curlRows.rows());
    }
}
