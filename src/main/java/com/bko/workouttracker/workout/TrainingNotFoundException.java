package com.bko.workouttracker.workout;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class TrainingNotFoundException extends RuntimeException {
    public TrainingNotFoundException(String trainingId) {
        super("Training not found: " + trainingId);
    }
}
