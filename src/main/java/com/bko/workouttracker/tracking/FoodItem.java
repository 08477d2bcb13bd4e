package com.bko.workouttracker.tracking;

public record FoodItem(String name, double quantity, String unit, int calories) {
}
