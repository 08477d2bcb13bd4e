package com.bko.workouttracker.shared;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class SettingsConfiguration {

    @Bean
    public AppSettings appSettings(EnvConfig envConfig) {
        WorkoutSettings workout = new WorkoutSettings(
                envConfig.get("workout.default_mode"),
                envConfig.get("workout.preferences_path"),
                envConfig.get("workout.seed_file")
        );
        HealthSyncSettings healthSync = new HealthSyncSettings(
                Boolean.parseBoolean(envConfig.get("health_sync.enabled", "false")),
                envConfig.get("health_sync.daily_steps_file")
        );
        return new AppSettings(workout, healthSync);
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
