package com.bko.workouttracker.tracking.web.dto;

import com.bko.workouttracker.tracking.FoodItem;

import java.util.List;

public record FoodLogRequestDto(
        List<FoodItem> foods
) { }
