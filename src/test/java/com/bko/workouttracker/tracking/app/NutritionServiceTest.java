package com.bko.workouttracker.tracking.app;

import com.bko.workouttracker.tracking.FoodItem;
import com.bko.workouttracker.tracking.NutritionEntry;
import com.bko.workouttracker.tracking.NutritionStore;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class NutritionServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 1, 10);

    private final NutritionStore store = mock(NutritionStore.class);
    private final NutritionService service = new NutritionService(store,
            Clock.fixed(Instant.parse("2024-01-10T10:00:00Z"), ZoneOffset.UTC));

    @Test
    void firstMealCreatesTodaysEntry() throws IOException {
        when(store.getEntry("trainee-1", TODAY)).thenReturn(Optional.empty());
        when(store.upsertEntry(any(NutritionEntry.class))).thenAnswer(invocation -> invocation.getArgument(0));

        NutritionEntry entry = service.logFoods("trainee-1", List.of(new FoodItem("Oats", 80, "g", 300)));

        assertNotNull(entry.id());
        assertEquals(TODAY, entry.date());
        assertEquals(300, entry.totalCalories());
    }

    @Test
    void laterMealsAppend() throws IOException {
        NutritionEntry breakfast = new NutritionEntry("n1", "trainee-1", TODAY,
                List.of(new FoodItem("Oats", 80, "g", 300)));
        when(store.getEntry("trainee-1", TODAY)).thenReturn(Optional.of(breakfast));
        when(store.upsertEntry(any(NutritionEntry.class))).thenAnswer(invocation -> invocation.getArgument(0));

        NutritionEntry entry = service.logFoods("trainee-1", List.of(
                new FoodItem("Chicken", 200, "g", 330),
                new FoodItem("Rice", 150, "g", 195)));

        assertEquals("n1", entry.id());
        assertEquals(3, entry.consumedFoods().size());
        assertEquals(825, entry.totalCalories());
    }

    @Test
    void rejectsEmptyOrInvalidFoods() {
        assertThrows(IllegalArgumentException.class, () -> service.logFoods("trainee-1", List.of()));
        assertThrows(IllegalArgumentException.class,
                () -> service.logFoods("trainee-1", List.of(new FoodItem(" ", 1, "g", 10))));
        assertThrows(IllegalArgumentException.class,
                () -> service.logFoods("trainee-1", List.of(new FoodItem("Cake", 1, "slice", -5))));
    }
}
