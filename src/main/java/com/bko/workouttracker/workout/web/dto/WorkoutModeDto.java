package com.bko.workouttracker.workout.web.dto;

public record WorkoutModeDto(
        String mode
) { }
