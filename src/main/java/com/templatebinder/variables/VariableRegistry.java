package com.templatebinder.variables;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.templatebinder.AppLogger;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Immutable catalog of every variable the store composition holds.
 * Loaded once from the bundled classpath resource (variables/standard-variables.json)
 * and shared process-wide; nothing mutates it afterwards.
 */
public final class VariableRegistry {

    private static final String CATALOG_RESOURCE = "variables/standard-variables.json";

    private static volatile VariableRegistry standard;

    private final List<VariableDefinition> variables;
    private final Map<String, VariableDefinition> byName;

    VariableRegistry(List<VariableDefinition> definitions) {
        Map<String, VariableDefinition> index = new LinkedHashMap<>();
        for (VariableDefinition definition : definitions) {
            if (index.putIfAbsent(definition.getName(), definition) != null) {
                throw new IllegalStateException("Duplicate variable name in catalog: " + definition.getName());
            }
        }
        this.variables = Collections.unmodifiableList(new ArrayList<>(definitions));
        this.byName = Collections.unmodifiableMap(index);
    }

    /**
     * The bundled standard catalog.
     */
    public static VariableRegistry standard() {
        VariableRegistry local = standard;
        if (local == null) {
            synchronized (VariableRegistry.class) {
                local = standard;
                if (local == null) {
                    local = loadBundled(new ObjectMapper());
                    standard = local;
                }
            }
        }
        return local;
    }

    static VariableRegistry loadBundled(ObjectMapper objectMapper) {
        try (InputStream is = VariableRegistry.class.getClassLoader().getResourceAsStream(CATALOG_RESOURCE)) {
            if (is == null) {
                throw new IllegalStateException("Variable catalog not found on classpath: " + CATALOG_RESOURCE);
            }
            JsonNode root = objectMapper.readTree(is);
            VariableRegistry registry = new VariableRegistry(parseCatalog(root));
            AppLogger.get().info("VariableRegistry loaded " + registry.size() + " variables");
            return registry;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load variable catalog: " + e.getMessage(), e);
        }
    }

    static List<VariableDefinition> parseCatalog(JsonNode root) {
        List<VariableDefinition> definitions = new ArrayList<>();
        for (JsonNode group : root.path("groups")) {
            VariableCategory category = VariableCategory.fromValue(group.path("category").asText(null));
            if (group.has("repeat")) {
                definitions.addAll(expandRepeatedGroup(group, category));
                continue;
            }
            for (JsonNode entry : group.path("variables")) {
                definitions.add(new VariableDefinition(
                    entry.path("name").asText(null),
                    category,
                    VariableDataType.fromValue(entry.path("dataType").asText(null)),
                    entry.path("description").asText(""),
                    entry.hasNonNull("defaultValue") ? entry.get("defaultValue").asText() : null
                ));
            }
        }
        return definitions;
    }

    // Groups such as players are declared once as a field list and repeated per index.
    private static List<VariableDefinition> expandRepeatedGroup(JsonNode group, VariableCategory category) {
        int repeat = group.path("repeat").asInt(0);
        String namePattern = group.path("namePattern").asText("{suffix}");
        List<VariableDefinition> expanded = new ArrayList<>();
        for (int n = 1; n <= repeat; n++) {
            String index = String.valueOf(n);
            for (JsonNode field : group.path("fields")) {
                String name = namePattern
                    .replace("{n}", index)
                    .replace("{suffix}", field.path("suffix").asText(""));
                String defaultValue = field.hasNonNull("defaultValue")
                    ? field.get("defaultValue").asText().replace("{n}", index)
                    : null;
                expanded.add(new VariableDefinition(
                    name,
                    category,
                    VariableDataType.fromValue(field.path("dataType").asText(null)),
                    field.path("description").asText("").replace("{n}", index),
                    defaultValue
                ));
            }
        }
        return expanded;
    }

    public List<VariableDefinition> getAll() {
        return variables;
    }

    public int size() {
        return variables.size();
    }

    /**
     * Looks a variable up by bare or store-prefixed name.
     * One leading store marker is stripped; the comparison is otherwise exact and case-sensitive.
     */
    public Optional<VariableDefinition> getByName(String nameOrStoreName) {
        if (nameOrStoreName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byName.get(VariableDefinition.stripStorePrefix(nameOrStoreName)));
    }

    /**
     * Same as {@link #getByName(String)} but fails fast on a name the catalog does not define.
     */
    public VariableDefinition require(String nameOrStoreName) {
        return getByName(nameOrStoreName).orElseThrow(() -> new UnknownVariableException(nameOrStoreName));
    }

    public boolean exists(String nameOrStoreName) {
        return getByName(nameOrStoreName).isPresent();
    }

    public List<VariableDefinition> getByCategory(VariableCategory category) {
        return variables.stream()
            .filter(v -> v.getCategory() == category)
            .collect(Collectors.toList());
    }

    public List<VariableDefinition> getByDataType(VariableDataType dataType) {
        return variables.stream()
            .filter(v -> v.getDataType() == dataType)
            .collect(Collectors.toList());
    }

    public List<String> getNames(boolean includeStorePrefix) {
        return variables.stream()
            .map(v -> includeStorePrefix ? v.getStoreName() : v.getName())
            .collect(Collectors.toList());
    }

    public List<String> getNames() {
        return getNames(false);
    }

    /**
     * Counts by category and by data type, plus the total.
     */
    public Map<String, Object> getSummary() {
        Map<VariableCategory, Integer> byCategory = new EnumMap<>(VariableCategory.class);
        for (VariableCategory category : VariableCategory.values()) {
            byCategory.put(category, 0);
        }
        Map<String, Integer> byType = new LinkedHashMap<>();
        for (VariableDefinition variable : variables) {
            byCategory.merge(variable.getCategory(), 1, Integer::sum);
            byType.merge(variable.getDataType().getValue(), 1, Integer::sum);
        }
        Map<String, Integer> categoryCounts = new LinkedHashMap<>();
        byCategory.forEach((category, count) -> categoryCounts.put(category.getValue(), count));

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("total", variables.size());
        summary.put("byCategory", categoryCounts);
        summary.put("byType", byType);
        return summary;
    }
}
