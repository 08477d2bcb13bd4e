package com.bko.workouttracker.tracking.app;

import com.bko.workouttracker.tracking.Measurement;
import com.bko.workouttracker.tracking.MeasurementStore;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MeasurementServiceTest {

    private final MeasurementStore store = mock(MeasurementStore.class);
    private final MeasurementService service = new MeasurementService(store);

    @Test
    void recordsNormalizedDimensions() throws IOException {
        when(store.upsert(anyString(), anyDouble(), anyMap())).thenAnswer(invocation -> new Measurement(
                "m1", invocation.getArgument(0), LocalDate.of(2024, 1, 10),
                invocation.getArgument(1), invocation.getArgument(2)));
        Map<String, Double> input = new HashMap<>();
        input.put(" Waist ", 82.0);
        input.put("arms", null);

        Measurement saved = service.record("trainee-1", 80.5, input);

        assertEquals(80.5, saved.weight());
        assertEquals(Map.of("waist", 82.0), saved.bodyMeasurements());
        verify(store).upsert("trainee-1", 80.5, Map.of("waist", 82.0));
    }

    @Test
    void rejectsInvalidWeightAndDimensions() throws IOException {
        assertThrows(IllegalArgumentException.class, () -> service.record("trainee-1", 0, Map.of()));
        assertThrows(IllegalArgumentException.class, () -> service.record("trainee-1", Double.NaN, Map.of()));
        assertThrows(IllegalArgumentException.class, () -> service.record("trainee-1", 80, Map.of("neck", 40.0)));
        assertThrows(IllegalArgumentException.class, () -> service.record("trainee-1", 80, Map.of("chest", -1.0)));
        verify(store, never()).upsert(anyString(), anyDouble(), any());
    }

    @Test
    void latestWeightIsTheNewestEntry() throws IOException {
        when(store.getForTrainee("trainee-1")).thenReturn(List.of(
                new Measurement("m2", "trainee-1", LocalDate.of(2024, 1, 10), 79.0, null),
                new Measurement("m1", "trainee-1", LocalDate.of(2024, 1, 3), 81.0, null)));
        when(store.getForTrainee("trainee-2")).thenReturn(List.of());

        assertEquals(Optional.of(79.0), service.latestWeight("trainee-1"));
        assertTrue(service.latestWeight("trainee-2").isEmpty());
    }
}
