package com.templatebinder.controllers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.templatebinder.AppLogger;
import com.templatebinder.TemplateBindingService;
import com.templatebinder.analysis.ProjectAnalyzer;
import com.templatebinder.matching.LayerKind;
import com.templatebinder.models.ExpressionRecommendation;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class AnalysisController implements Controller {
    private final TemplateBindingService bindingService;
    private final ObjectMapper objectMapper;

    public AnalysisController(TemplateBindingService bindingService, ObjectMapper objectMapper) {
        this.bindingService = bindingService;
        this.objectMapper = objectMapper;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.post("/api/analyze", this::analyze);
        app.post("/api/apply", this::apply);
    }

    private void analyze(Context ctx) throws Exception {
        JsonNode json = objectMapper.readTree(ctx.body());
        String path = Controller.text(json, "path");
        if (path == null || path.isBlank()) {
            ctx.status(400).json(Map.of("error", "path is required"));
            return;
        }
        List<ExpressionRecommendation> recommendations =
            bindingService.analyze(path, Controller.number(json, "minConfidence"));

        List<LayerKind> kinds = new ArrayList<>();
        for (JsonNode kind : json.path("layerKinds")) {
            kinds.add(LayerKind.fromAttribute(kind.asText()));
        }
        List<String> comps = new ArrayList<>();
        for (JsonNode comp : json.path("compositions")) {
            comps.add(comp.asText());
        }
        recommendations = ProjectAnalyzer.filter(recommendations, null, kinds, comps);

        Map<String, Integer> groups = new LinkedHashMap<>();
        ProjectAnalyzer.groupByConfidenceBucket(recommendations)
            .forEach((bucket, recs) -> groups.put(bucket, recs.size()));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("count", recommendations.size());
        body.put("groups", groups);
        body.put("recommendations", ProjectAnalyzer.toExportableMaps(recommendations));
        ctx.json(body);
    }

    private void apply(Context ctx) throws Exception {
        JsonNode json = objectMapper.readTree(ctx.body());
        String path = Controller.text(json, "path");
        if (path == null || path.isBlank()) {
            ctx.status(400).json(Map.of("error", "path is required"));
            return;
        }
        TemplateBindingService.ApplyOutcome outcome = bindingService.apply(path,
            Controller.number(json, "minConfidence"), Controller.text(json, "outputPath"));
        AppLogger.get().info("Apply on " + path + ": " + outcome.batch().getMessage());
        ctx.status(outcome.save().isSuccess() ? 200 : 500).json(outcome);
    }
}
