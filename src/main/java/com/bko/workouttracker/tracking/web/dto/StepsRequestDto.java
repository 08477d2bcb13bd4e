package com.bko.workouttracker.tracking.web.dto;

import java.time.LocalDate;

public record StepsRequestDto(
        LocalDate date,
        Integer steps
) { }
