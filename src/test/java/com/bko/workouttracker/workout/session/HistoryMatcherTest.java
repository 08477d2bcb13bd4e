package com.bko.workouttracker.workout.session;

import com.bko.workouttracker.workout.ActualSet;
import com.bko.workouttracker.workout.HistoryRecord;
import com.bko.workouttracker.workout.HistoryStore;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class HistoryMatcherTest {

    private final HistoryRecord bench = new HistoryRecord("h1", "trainee-1", "t0", "Bench Press",
            Instant.parse("2024-01-03T10:00:00Z"), List.of(new ActualSet(8, 60.0)), null);

    @Test
    void returnsLastPerformanceForExactName() throws Exception {
        HistoryStore store = mock(HistoryStore.class);
        when(store.getLast("trainee-1", "Bench Press")).thenReturn(Optional.of(bench));
        when(store.getLast("trainee-1", "bench press")).thenReturn(Optional.empty());

        HistoryMatcher matcher = new HistoryMatcher(store);

        assertEquals(Optional.of(bench), matcher.findLastPerformance("trainee-1", "Bench Press"));
        assertTrue(matcher.findLastPerformance("trainee-1", "bench press").isEmpty());
    }

    @Test
    void lookupFailureLooksLikeNoHistory() throws Exception {
        HistoryStore store = mock(HistoryStore.class);
        when(store.getLast("trainee-1", "Squat")).thenThrow(new IOException("offline"));
        when(store.getLast("trainee-1", "Bench Press")).thenReturn(Optional.of(bench));

        HistoryMatcher matcher = new HistoryMatcher(store);

        assertTrue(matcher.findLastPerformance("trainee-1", "Squat").isEmpty());
        Map<String, HistoryRecord> found = matcher.findLastPerformances("trainee-1", List.of("Squat", "Bench Press"));
        assertEquals(Map.of("Bench Press", bench), found);
    }

    @Test
    void blankNameSkipsLookup() {
        HistoryStore store = mock(HistoryStore.class);

        assertTrue(new HistoryMatcher(store).findLastPerformance("trainee-1", "").isEmpty());
        verifyNoInteractions(store);
    }
}
