package com.templatebinder.store;

import com.templatebinder.AppLogger;
import com.templatebinder.aepx.AepxDocument;
import com.templatebinder.aepx.DocumentParseException;
import com.templatebinder.expressions.ExpressionConfig;
import com.templatebinder.variables.VariableDefinition;
import com.templatebinder.variables.VariableRegistry;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the variable store composition: one text layer per catalog variable, named by
 * its store name and laid out in a grid, which every bound layer reads from.
 */
public class VariableStoreCompositionGenerator {

    public static final int DEFAULT_WIDTH = 1920;
    public static final int DEFAULT_HEIGHT = 1080;
    static final int DURATION_SECONDS = 8;
    static final int FRAME_RATE = 30;

    private final VariableRegistry registry;
    private final int width;
    private final int height;

    public VariableStoreCompositionGenerator(VariableRegistry registry, int width, int height) {
        this.registry = registry != null ? registry : VariableRegistry.standard();
        this.width = width;
        this.height = height;
    }

    public VariableStoreCompositionGenerator() {
        this(VariableRegistry.standard(), DEFAULT_WIDTH, DEFAULT_HEIGHT);
    }

    /**
     * Row-major grid: variable {@code i} goes to column {@code i % columns}, row {@code i / columns}.
     */
    public List<StoreLayer> layout(List<VariableDefinition> variables, StoreLayout layout) {
        List<StoreLayer> layers = new ArrayList<>(variables.size());
        for (int i = 0; i < variables.size(); i++) {
            int row = i / layout.columns();
            int col = i % layout.columns();
            int x = layout.startX() + col * layout.horizontalSpacing();
            int y = layout.startY() + row * layout.verticalSpacing();
            layers.add(StoreLayer.of(variables.get(i), x, y, layout));
        }
        AppLogger.get().info("Calculated positions for " + layers.size() + " layers in "
            + layout.columns() + " columns");
        return layers;
    }

    public StoreComposition generate(String compositionName) {
        return generate(compositionName, registry.getAll(), StoreLayout.defaults());
    }

    public StoreComposition generate(String compositionName, List<VariableDefinition> variables, StoreLayout layout) {
        String name = compositionName == null || compositionName.isBlank()
            ? ExpressionConfig.DEFAULT_STORE_COMPOSITION
            : compositionName;
        StoreComposition composition = new StoreComposition(name, width, height, DURATION_SECONDS, FRAME_RATE,
            layout(variables, layout));
        AppLogger.get().info("Generated " + name + " composition with " + composition.layers().size() + " layers");
        return composition;
    }

    /**
     * Project document holding only the store composition:
     * {@code AfterEffectsProject/Project/Items/Composition/Layers/Layer}.
     */
    public AepxDocument toDocument(StoreComposition composition) throws DocumentParseException {
        AepxDocument doc = AepxDocument.create("AfterEffectsProject");
        Element project = doc.appendChild(doc.getRoot(), "Project");
        Element items = doc.appendChild(project, "Items");

        Element comp = doc.appendChild(items, AepxDocument.COMPOSITION);
        comp.setAttribute(AepxDocument.NAME_ATTR, composition.name());
        comp.setAttribute("width", String.valueOf(composition.width()));
        comp.setAttribute("height", String.valueOf(composition.height()));
        comp.setAttribute("duration", String.valueOf(composition.duration()));
        comp.setAttribute("frameRate", String.valueOf(composition.frameRate()));

        Element layers = doc.appendChild(comp, AepxDocument.LAYERS);
        int index = 1;
        for (StoreLayer layer : composition.layers()) {
            Element element = doc.appendChild(layers, AepxDocument.LAYER);
            element.setAttribute("index", String.valueOf(index++));
            element.setAttribute(AepxDocument.NAME_ATTR, layer.name());
            element.setAttribute(AepxDocument.TYPE_ATTR, "text");
            addValueProperty(doc, element, "sourceText", layer.sourceText());
            addValueProperty(doc, element, "position", layer.x() + "," + layer.y());
            addValueProperty(doc, element, "fontSize", String.valueOf(layer.fontSize()));
            addValueProperty(doc, element, "fontFamily", layer.fontFamily());
            addValueProperty(doc, element, "fillColor", layer.fillColor());
            VariableDefinition variable = layer.variable();
            doc.appendComment(element, " Variable: " + variable.getName()
                + " | Category: " + variable.getCategory().getValue()
                + " | Type: " + variable.getDataType().getValue() + " ");
        }
        return doc;
    }

    private static void addValueProperty(AepxDocument doc, Element layer, String name, String value) {
        Element property = doc.appendChild(layer, AepxDocument.PROPERTY);
        property.setAttribute(AepxDocument.NAME_ATTR, name);
        property.setAttribute("value", value != null ? value : "");
    }

    public StoreValidationResult validate(StoreComposition composition) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        List<StoreLayer> layers = composition.layers();
        for (int i = 0; i < layers.size(); i++) {
            StoreLayer layer = layers.get(i);
            String name = layer.name();
            if (name == null || !name.startsWith(VariableDefinition.STORE_PREFIX)) {
                errors.add("Layer " + i + ": '" + name + "' does not start with '"
                    + VariableDefinition.STORE_PREFIX + "'");
            }
            if (!seen.add(name)) {
                errors.add("Duplicate layer name: '" + name + "'");
            }
            if (layer.x() < 0 || layer.y() < 0) {
                warnings.add("Layer '" + name + "' has negative position: (" + layer.x() + ", " + layer.y() + ")");
            }
            if (layer.x() > composition.width()) {
                warnings.add("Layer '" + name + "' X position " + layer.x() + " exceeds comp width");
            }
            if (layer.y() > composition.height()) {
                warnings.add("Layer '" + name + "' Y position " + layer.y() + " exceeds comp height");
            }
        }
        int expected = registry.size();
        if (layers.size() != expected) {
            warnings.add("Layer count " + layers.size() + " differs from standard variable count " + expected);
        }

        StoreValidationResult result = new StoreValidationResult(errors, warnings);
        if (!result.isValid()) {
            AppLogger.get().error("Store composition validation failed with " + errors.size() + " errors");
        } else if (!warnings.isEmpty()) {
            AppLogger.get().warn("Store composition validation passed with " + warnings.size() + " warnings");
        } else {
            AppLogger.get().info("Store composition validation passed with no issues");
        }
        return result;
    }
}
