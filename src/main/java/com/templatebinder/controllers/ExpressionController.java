package com.templatebinder.controllers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.templatebinder.TemplateBindingService;
import com.templatebinder.aepx.ExportResult;
import com.templatebinder.aepx.ExpressionListing;
import com.templatebinder.aepx.ExpressionWriteResult;
import com.templatebinder.expressions.ExpressionSyntaxValidator;
import com.templatebinder.expressions.ExpressionTarget;
import com.templatebinder.expressions.SynthesisRequest;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.LinkedHashMap;
import java.util.Map;

public class ExpressionController implements Controller {
    private final TemplateBindingService bindingService;
    private final ObjectMapper objectMapper;

    public ExpressionController(TemplateBindingService bindingService, ObjectMapper objectMapper) {
        this.bindingService = bindingService;
        this.objectMapper = objectMapper;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/expressions", this::listExpressions);
        app.post("/api/expressions", this::addExpression);
        app.delete("/api/expressions", this::removeExpression);
        app.post("/api/expressions/export", this::exportExpressions);
        app.post("/api/expressions/synthesize", this::synthesize);
    }

    private void listExpressions(Context ctx) throws Exception {
        String path = ctx.queryParam("path");
        if (path == null || path.isBlank()) {
            ctx.status(400).json(Map.of("error", "Path parameter required"));
            return;
        }
        ExpressionListing listing = bindingService.listExpressions(path, ctx.queryParam("comp"));
        ctx.status(listing.isSuccess() ? 200 : 404).json(listing);
    }

    private void addExpression(Context ctx) throws Exception {
        JsonNode json = objectMapper.readTree(ctx.body());
        String path = Controller.text(json, "path");
        String target = Controller.text(json, "target");
        if (path == null || target == null) {
            ctx.status(400).json(Map.of("error", "path and target are required"));
            return;
        }
        boolean validate = !json.has("validate") || json.get("validate").asBoolean(true);
        ExpressionWriteResult result = bindingService.addExpression(path,
            Controller.text(json, "comp"), Controller.text(json, "layer"),
            ExpressionTarget.fromValue(target), Controller.text(json, "expression"), validate);
        ctx.status(statusFor(result)).json(result);
    }

    private void removeExpression(Context ctx) throws Exception {
        String path = ctx.queryParam("path");
        String target = ctx.queryParam("target");
        if (path == null || target == null) {
            ctx.status(400).json(Map.of("error", "path and target parameters required"));
            return;
        }
        ExpressionWriteResult result = bindingService.removeExpression(path,
            ctx.queryParam("comp"), ctx.queryParam("layer"), ExpressionTarget.fromValue(target));
        ctx.status(statusFor(result)).json(result);
    }

    private void exportExpressions(Context ctx) throws Exception {
        JsonNode json = objectMapper.readTree(ctx.body());
        String path = Controller.text(json, "path");
        if (path == null || path.isBlank()) {
            ctx.status(400).json(Map.of("error", "path is required"));
            return;
        }
        ExportResult result = bindingService.exportExpressions(path,
            Controller.text(json, "outputPath"), Controller.text(json, "comp"));
        ctx.status(result.isSuccess() ? 200 : 422).json(result);
    }

    private void synthesize(Context ctx) throws Exception {
        SynthesisRequest request = objectMapper.readValue(ctx.body(), SynthesisRequest.class);
        String expression = request.synthesize(bindingService.synthesizer());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("expression", expression);
        body.put("errors", ExpressionSyntaxValidator.validate(expression).getErrors());
        ctx.json(body);
    }

    private static int statusFor(ExpressionWriteResult result) {
        if (result.isSuccess()) {
            return 200;
        }
        return result.isNotFound() ? 404 : 422;
    }
}
