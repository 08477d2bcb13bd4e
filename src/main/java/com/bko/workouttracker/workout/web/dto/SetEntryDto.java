package com.bko.workouttracker.workout.web.dto;

public record SetEntryDto(
        String reps,
        String weight,
        Boolean deferSave
) { }
