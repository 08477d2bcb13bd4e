package com.bko.workouttracker.integrations.preferences;

import com.bko.workouttracker.shared.AppSettings;
import com.bko.workouttracker.workout.WorkoutPreferenceStore;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Key/value preferences kept in a single JSON object on disk.
 */
@Component
public class JsonFilePreferenceStore implements WorkoutPreferenceStore {
    private static final TypeReference<LinkedHashMap<String, String>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final Path path;

    public JsonFilePreferenceStore(ObjectMapper objectMapper, AppSettings settings) {
        this(objectMapper, Path.of(settings.workout().preferencesPath()));
    }

    JsonFilePreferenceStore(ObjectMapper objectMapper, Path path) {
        this.objectMapper = objectMapper;
        this.path = path;
    }

    @Override
    public synchronized Optional<String> get(String key) throws IOException {
        return Optional.ofNullable(read().get(key));
    }

    @Override
    public synchronized void put(String key, String value) throws IOException {
        Map<String, String> values = read();
        values.put(key, value);
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), values);
        Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
    }

    private Map<String, String> read() throws IOException {
        if (!Files.exists(path) || Files.size(path) == 0) {
            return new LinkedHashMap<>();
        }
        return objectMapper.readValue(path.toFile(), MAP_TYPE);
    }
}
