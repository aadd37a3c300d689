package com.templatebinder.aepx;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.templatebinder.AppLogger;
import com.templatebinder.expressions.ExpressionSyntaxValidator;
import com.templatebinder.expressions.ExpressionTarget;
import com.templatebinder.expressions.ExpressionValidationResult;
import com.templatebinder.models.LayerExpression;
import org.w3c.dom.Element;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Adds, discovers and removes expressions in a template document.
 * <p>
 * Each property holds at most one Expression node, so writing the same target twice
 * overwrites in place. Structural problems (missing composition, layer, property or
 * expression) and invalid expression text come back as failed results; the document is
 * only touched once every check for an item has passed.
 * <p>
 * Not thread-safe: one writer per document.
 */
public class ExpressionWriter {

    private static final String CDATA_OPEN = "<![CDATA[";
    private static final String CDATA_CLOSE = "]]>";

    private final AepxDocument document;
    private final ObjectMapper objectMapper;
    private final List<LayerExpression> added = new ArrayList<>();
    private final List<LayerExpression> removed = new ArrayList<>();

    public ExpressionWriter(AepxDocument document) {
        this(document, new ObjectMapper());
    }

    public ExpressionWriter(AepxDocument document, ObjectMapper objectMapper) {
        if (document == null) {
            throw new IllegalArgumentException("document is required");
        }
        this.document = document;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public static ExpressionWriter open(Path path) throws IOException {
        return new ExpressionWriter(AepxDocument.load(path));
    }

    public static ExpressionWriter fromXml(String xml) throws DocumentParseException {
        return new ExpressionWriter(AepxDocument.parse(xml));
    }

    public AepxDocument getDocument() {
        return document;
    }

    public ExpressionWriteResult addExpression(String compName, String layerName, ExpressionTarget target,
                                               String expression) {
        return addExpression(compName, layerName, target, expression, true);
    }

    public ExpressionWriteResult addExpression(String compName, String layerName, ExpressionTarget target,
                                               String expression, boolean validate) {
        if (target == null) {
            return ExpressionWriteResult.failure("Expression target is required");
        }
        if (expression == null) {
            return ExpressionWriteResult.failure("Expression text is required");
        }
        if (validate) {
            ExpressionValidationResult validation = ExpressionSyntaxValidator.validate(expression);
            if (!validation.isValid()) {
                AppLogger.get().warn("Expression syntax validation failed: " + validation.getErrors());
                return ExpressionWriteResult.invalid(validation.getErrors());
            }
        }

        Optional<Element> comp = findComposition(compName);
        if (comp.isEmpty()) {
            return ExpressionWriteResult.notFound(NotFoundLevel.COMPOSITION, "Composition not found: " + compName);
        }
        Optional<Element> layer = findLayer(comp.get(), layerName);
        if (layer.isEmpty()) {
            return ExpressionWriteResult.notFound(NotFoundLevel.LAYER,
                "Layer not found: " + layerName + " in " + compName);
        }

        String propertyName = target.getPropertyName();
        Element property = AepxDocument.findProperty(layer.get(), propertyName).orElse(null);
        if (property == null) {
            property = document.appendChild(layer.get(), AepxDocument.PROPERTY);
            property.setAttribute(AepxDocument.NAME_ATTR, propertyName);
            AppLogger.get().debug("Created new property: " + propertyName);
        }
        Element expressionNode = AepxDocument.findExpression(property).orElse(null);
        if (expressionNode == null) {
            expressionNode = document.appendChild(property, AepxDocument.EXPRESSION);
        }
        document.setCData(expressionNode, stripCData(expression));

        added.add(new LayerExpression(compName, layerName, target, expression));
        AppLogger.get().info("Added expression to " + compName + "/" + layerName + "/" + propertyName);
        return ExpressionWriteResult.written(compName, layerName, propertyName);
    }

    public ExpressionWriteResult removeExpression(String compName, String layerName, ExpressionTarget target) {
        if (target == null) {
            return ExpressionWriteResult.failure("Expression target is required");
        }
        Optional<Element> comp = findComposition(compName);
        if (comp.isEmpty()) {
            return ExpressionWriteResult.notFound(NotFoundLevel.COMPOSITION, "Composition not found: " + compName);
        }
        Optional<Element> layer = findLayer(comp.get(), layerName);
        if (layer.isEmpty()) {
            return ExpressionWriteResult.notFound(NotFoundLevel.LAYER, "Layer not found: " + layerName);
        }
        String propertyName = target.getPropertyName();
        Optional<Element> property = AepxDocument.findProperty(layer.get(), propertyName);
        if (property.isEmpty()) {
            return ExpressionWriteResult.notFound(NotFoundLevel.PROPERTY,
                "Property not found: " + propertyName + " on layer " + layerName);
        }
        Optional<Element> expressionNode = AepxDocument.findExpression(property.get());
        if (expressionNode.isEmpty()) {
            return ExpressionWriteResult.notFound(NotFoundLevel.EXPRESSION,
                "No expression found on " + layerName + "/" + propertyName);
        }
        property.get().removeChild(expressionNode.get());

        removed.add(new LayerExpression(compName, layerName, target, null));
        AppLogger.get().info("Removed expression from " + compName + "/" + layerName + "/" + propertyName);
        return ExpressionWriteResult.removed(compName, layerName, propertyName);
    }

    /**
     * Writes each expression independently. Without {@code stopOnError} the batch always
     * reports success and lists per-item failures; with it, the first failure ends the
     * batch and the result is a failure.
     */
    public BatchWriteResult addMultiple(List<LayerExpression> expressions, boolean validate, boolean stopOnError) {
        List<String> successes = new ArrayList<>();
        List<BatchWriteResult.BatchFailure> failures = new ArrayList<>();
        List<LayerExpression> items = expressions != null ? expressions : List.of();

        for (LayerExpression item : items) {
            ExpressionWriteResult result = addExpression(item.getCompositionName(), item.getLayerName(),
                item.getTarget(), item.getExpression(), validate);
            if (result.isSuccess()) {
                successes.add(item.getLayerName());
            } else {
                failures.add(new BatchWriteResult.BatchFailure(item.getLayerName(), result.getMessage()));
                if (stopOnError) {
                    break;
                }
            }
        }

        if (!failures.isEmpty() && stopOnError) {
            AppLogger.get().error("Batch add stopped on error: " + successes.size() + " succeeded, "
                + failures.size() + " failed");
            return BatchWriteResult.stopped(successes, failures);
        }
        if (!failures.isEmpty()) {
            AppLogger.get().warn("Batch add completed with errors: " + successes.size() + " succeeded, "
                + failures.size() + " failed");
        } else {
            AppLogger.get().info("Batch add completed: " + successes.size() + " expressions added");
        }
        return BatchWriteResult.completed(successes, failures);
    }

    public ExpressionListing findWithExpressions() {
        return findWithExpressions(null);
    }

    /**
     * Every expression in the named composition, or in all compositions when
     * {@code compName} is null or blank.
     */
    public ExpressionListing findWithExpressions(String compName) {
        List<Element> comps;
        if (compName != null && !compName.isBlank()) {
            Optional<Element> comp = findComposition(compName);
            if (comp.isEmpty()) {
                return ExpressionListing.failure("Composition not found: " + compName);
            }
            comps = List.of(comp.get());
        } else {
            comps = document.compositions();
        }

        List<ExpressionEntry> entries = new ArrayList<>();
        for (Element comp : comps) {
            String foundComp = AepxDocument.nameOf(comp, "Unknown");
            for (Element layer : AepxDocument.layers(comp)) {
                String foundLayer = AepxDocument.nameOf(layer, "Unknown");
                for (Element property : AepxDocument.properties(layer)) {
                    Optional<Element> expressionNode = AepxDocument.findExpression(property);
                    if (expressionNode.isPresent()) {
                        String text = stripCData(expressionNode.get().getTextContent()).strip();
                        entries.add(new ExpressionEntry(foundComp, foundLayer,
                            AepxDocument.nameOf(property, "Unknown"), text));
                    }
                }
            }
        }
        AppLogger.get().info("Found " + entries.size() + " layers with expressions");
        return ExpressionListing.of(entries);
    }

    public ExportResult exportToJson(Path outputPath, String compName) {
        ExpressionListing listing = findWithExpressions(compName);
        if (!listing.isSuccess()) {
            return ExportResult.failure(listing.getMessage());
        }
        try {
            Path parent = outputPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(outputPath.toFile(), listing);
            AppLogger.get().info("Exported expressions to " + outputPath);
            return ExportResult.exported(outputPath.toString(), listing.getCount());
        } catch (IOException e) {
            AppLogger.get().error("Failed to export expressions: " + e.getMessage());
            return ExportResult.failure(e.getMessage());
        }
    }

    /**
     * Saves the document to {@code outputPath}, or over its source file when the path is null.
     */
    public ExportResult saveToFile(Path outputPath) {
        Path target = outputPath != null ? outputPath : document.getSourcePath().orElse(null);
        if (target == null) {
            return ExportResult.failure("No output path specified and no original file path");
        }
        try {
            document.writeTo(target);
            AppLogger.get().info("Saved AEPX to " + target);
            return ExportResult.saved(target.toString());
        } catch (IOException e) {
            AppLogger.get().error("Failed to save AEPX: " + e.getMessage());
            return ExportResult.failure(e.getMessage());
        }
    }

    public WriterStatistics getStatistics() {
        return new WriterStatistics(added.size(), removed.size(), countByComp(added), countByComp(removed));
    }

    /**
     * Unified diff between the XML as loaded and the document's current serialization.
     */
    public String previewDiff() {
        String name = document.getSourcePath().map(Path::toString).orElse("template.aepx");
        List<String> original = lines(document.getOriginalXml());
        List<String> current = lines(document.toXml());
        var patch = DiffUtils.diff(original, current);
        List<String> unified = UnifiedDiffUtils.generateUnifiedDiff(name, name, original, patch, 3);
        return String.join("\n", unified);
    }

    @Override
    public String toString() {
        return document.toXml();
    }

    private Optional<Element> findComposition(String compName) {
        Optional<Element> comp = document.findComposition(compName);
        if (comp.isPresent()) {
            AppLogger.get().debug("Found composition: " + compName);
        } else {
            AppLogger.get().warn("Composition not found: " + compName);
        }
        return comp;
    }

    private Optional<Element> findLayer(Element comp, String layerName) {
        Optional<Element> container = AepxDocument.layersContainer(comp);
        if (container.isEmpty()) {
            AppLogger.get().warn("No Layers element in composition");
            return Optional.empty();
        }
        Optional<Element> layer = AepxDocument.findLayer(container.get(), layerName);
        if (layer.isEmpty()) {
            AppLogger.get().warn("Layer not found: " + layerName);
        }
        return layer;
    }

    private static Map<String, Integer> countByComp(List<LayerExpression> log) {
        Map<String, Integer> grouped = new LinkedHashMap<>();
        for (LayerExpression entry : log) {
            grouped.merge(entry.getCompositionName(), 1, Integer::sum);
        }
        return grouped;
    }

    private static List<String> lines(String text) {
        return Arrays.asList(text.replace("\r\n", "\n").split("\n", -1));
    }

    static String stripCData(String text) {
        if (text == null) {
            return "";
        }
        return text.replace(CDATA_OPEN, "").replace(CDATA_CLOSE, "");
    }
}
