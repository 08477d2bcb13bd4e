package com.bko.workouttracker.workout.web;

import com.bko.workouttracker.workout.WorkoutMode;
import com.bko.workouttracker.workout.WorkoutModeUseCase;
import com.bko.workouttracker.workout.web.dto.WorkoutModeDto;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;

@RestController
@RequestMapping("/preferences/workout-mode")
public class WorkoutModeController {
    private final WorkoutModeUseCase workoutModeUseCase;

    public WorkoutModeController(WorkoutModeUseCase workoutModeUseCase) {
        this.workoutModeUseCase = workoutModeUseCase;
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public WorkoutModeDto get() {
        return new WorkoutModeDto(workoutModeUseCase.preferredMode().preferenceValue());
    }

    @PutMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public WorkoutModeDto update(@RequestBody WorkoutModeDto request) throws IOException {
        WorkoutMode mode = WorkoutMode.fromPreference(request.mode())
                .orElseThrow(() -> new IllegalArgumentException("Unknown workout mode: " + request.mode()));
        return new WorkoutModeDto(workoutModeUseCase.updatePreferredMode(mode).preferenceValue());
    }
}
