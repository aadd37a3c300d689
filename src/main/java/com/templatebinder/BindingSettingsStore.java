package com.templatebinder;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.templatebinder.models.BindingSettings;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public class BindingSettingsStore {
    private final ObjectMapper objectMapper;
    private Path settingsPath;

    public BindingSettingsStore(Path workspaceRoot, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        configure(workspaceRoot);
    }

    public void configure(Path workspaceRoot) {
        this.settingsPath = workspaceRoot.resolve(".template-binder").resolve("settings.json");
    }

    public Path getSettingsPath() {
        return settingsPath;
    }

    public BindingSettings loadOrDefault() {
        if (settingsPath == null || !Files.exists(settingsPath)) {
            return BindingSettings.defaults();
        }
        try {
            BindingSettings loaded = objectMapper.readValue(settingsPath.toFile(), BindingSettings.class);
            return loaded != null ? loaded : BindingSettings.defaults();
        } catch (IOException e) {
            AppLogger.get().warn("Unreadable settings at " + settingsPath + ", using defaults: " + e.getMessage());
            return BindingSettings.defaults();
        }
    }

    public void save(BindingSettings settings) throws IOException {
        if (settingsPath == null || settings == null) {
            return;
        }
        Files.createDirectories(settingsPath.getParent());
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(settingsPath.toFile(), settings);
    }
}
