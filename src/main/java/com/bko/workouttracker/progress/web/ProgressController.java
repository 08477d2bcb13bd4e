package com.bko.workouttracker.progress.web;

import com.bko.workouttracker.progress.ProgressSnapshot;
import com.bko.workouttracker.progress.ProgressUseCase;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ProgressController {
    private final ProgressUseCase progressUseCase;

    public ProgressController(ProgressUseCase progressUseCase) {
        this.progressUseCase = progressUseCase;
    }

    @GetMapping(value = "/trainees/{traineeId}/progress", produces = MediaType.APPLICATION_JSON_VALUE)
    public ProgressSnapshot progress(@PathVariable String traineeId) {
        return progressUseCase.loadProgress(traineeId);
    }
}
