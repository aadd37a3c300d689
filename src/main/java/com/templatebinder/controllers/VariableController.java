package com.templatebinder.controllers;

import com.templatebinder.variables.VariableCategory;
import com.templatebinder.variables.VariableDataType;
import com.templatebinder.variables.VariableDefinition;
import com.templatebinder.variables.VariableRegistry;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

public class VariableController implements Controller {
    private final VariableRegistry registry;

    public VariableController(VariableRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/variables", this::listVariables);
        app.get("/api/variables/summary", this::getSummary);
        app.get("/api/variables/{name}", this::getVariable);
    }

    private void listVariables(Context ctx) {
        String category = ctx.queryParam("category");
        String dataType = ctx.queryParam("dataType");
        List<VariableDefinition> variables = registry.getAll();
        if (category != null && !category.isBlank()) {
            VariableCategory wanted = VariableCategory.fromValue(category);
            variables = variables.stream().filter(v -> v.getCategory() == wanted).collect(Collectors.toList());
        }
        if (dataType != null && !dataType.isBlank()) {
            VariableDataType wanted = VariableDataType.fromValue(dataType);
            variables = variables.stream().filter(v -> v.getDataType() == wanted).collect(Collectors.toList());
        }
        ctx.json(Map.of("count", variables.size(), "variables", variables));
    }

    private void getSummary(Context ctx) {
        ctx.json(registry.getSummary());
    }

    private void getVariable(Context ctx) {
        String name = ctx.pathParam("name");
        Optional<VariableDefinition> variable = registry.getByName(name);
        if (variable.isEmpty()) {
            ctx.status(404).json(Map.of("error", "Variable not found: " + name));
            return;
        }
        ctx.json(variable.get());
    }
}
