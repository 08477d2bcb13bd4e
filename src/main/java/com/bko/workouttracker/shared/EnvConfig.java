package com.bko.workouttracker.shared;

import io.github.cdimascio.dotenv.Dotenv;
import org.springframework.stereotype.Component;

@Component
public class EnvConfig {
    private final Dotenv dotenv;

    public EnvConfig() {
        this(Dotenv.configure()
                .ignoreIfMissing()
                .load());
    }

    EnvConfig(Dotenv dotenv) {
        this.dotenv = dotenv;
    }

    public String get(String key) {
        String envKey = key.toUpperCase()
                .replace(".", "_")
                .replace("-", "_");
        String value = dotenv.get(envKey);
        if (value == null) {
            value = System.getenv(envKey);
        }
        return value == null ? null : value.trim();
    }

    public String get(String key, String defaultValue) {
        String value = get(key);
        return value == null || value.isBlank() ? defaultValue : value;
    }
}
