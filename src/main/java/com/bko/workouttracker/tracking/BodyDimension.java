package com.bko.workouttracker.tracking;

import java.util.Optional;

public enum BodyDimension {
    WAIST("waist"),
    CHEST("chest"),
    ARMS("arms"),
    HIPS("hips");

    private final String key;

    BodyDimension(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static Optional<BodyDimension> fromKey(String key) {
        for (BodyDimension dimension : values()) {
            if (dimension.key.equals(key)) {
                return Optional.of(dimension);
            }
        }
        return Optional.empty();
    }
}
