package com.bko.workouttracker.workout.web.dto;

import java.util.List;
import java.util.Map;

public record BulkEntryDto(
        Map<String, List<SetEntryDto>> exercises
) { }
