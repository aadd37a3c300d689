package com.templatebinder.controllers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.templatebinder.TemplateBindingService;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.Map;

public class StoreCompositionController implements Controller {
    private final TemplateBindingService bindingService;
    private final ObjectMapper objectMapper;

    public StoreCompositionController(TemplateBindingService bindingService, ObjectMapper objectMapper) {
        this.bindingService = bindingService;
        this.objectMapper = objectMapper;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.post("/api/hard-card", this::generate);
    }

    private void generate(Context ctx) throws Exception {
        JsonNode json = objectMapper.readTree(ctx.body());
        String outputPath = Controller.text(json, "outputPath");
        if (outputPath == null || outputPath.isBlank()) {
            ctx.status(400).json(Map.of("error", "outputPath is required"));
            return;
        }
        TemplateBindingService.StoreCompositionOutcome outcome = bindingService.generateStoreComposition(outputPath);
        ctx.status(outcome.validation().isValid() ? 200 : 422).json(outcome);
    }
}
