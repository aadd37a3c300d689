package com.templatebinder.controllers;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.templatebinder.TemplateBindingService;
import com.templatebinder.models.BindingSettings;
import io.javalin.Javalin;
import io.javalin.http.Context;

public class SettingsController implements Controller {
    private final TemplateBindingService bindingService;
    private final ObjectMapper objectMapper;

    public SettingsController(TemplateBindingService bindingService, ObjectMapper objectMapper) {
        this.bindingService = bindingService;
        this.objectMapper = objectMapper;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/settings", this::getSettings);
        app.put("/api/settings", this::updateSettings);
    }

    private void getSettings(Context ctx) {
        ctx.json(bindingService.getSettings());
    }

    private void updateSettings(Context ctx) throws Exception {
        BindingSettings updated = objectMapper.readValue(ctx.body(), BindingSettings.class);
        ctx.json(bindingService.updateSettings(updated));
    }
}
