package com.templatebinder;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.templatebinder.aepx.AepxDocument;
import com.templatebinder.aepx.BatchWriteResult;
import com.templatebinder.aepx.ExportResult;
import com.templatebinder.aepx.ExpressionListing;
import com.templatebinder.aepx.ExpressionWriteResult;
import com.templatebinder.aepx.ExpressionWriter;
import com.templatebinder.analysis.ProjectAnalyzer;
import com.templatebinder.expressions.ExpressionSynthesizer;
import com.templatebinder.expressions.ExpressionTarget;
import com.templatebinder.matching.LayerMatcher;
import com.templatebinder.models.BindingSettings;
import com.templatebinder.models.ExpressionRecommendation;
import com.templatebinder.models.LayerExpression;
import com.templatebinder.store.StoreComposition;
import com.templatebinder.store.StoreValidationResult;
import com.templatebinder.store.VariableStoreCompositionGenerator;
import com.templatebinder.variables.VariableRegistry;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Workspace-level operations on template files: analyze, apply, list, add, remove and
 * export expressions, and generate the store composition.
 * <p>
 * Every call loads the template fresh from disk. Calls that write a file are serialized.
 */
public class TemplateBindingService {
    private final TemplateWorkspace workspace;
    private final BindingSettingsStore settingsStore;
    private final VariableRegistry registry;
    private final ObjectMapper objectMapper;
    private volatile BindingSettings settings;

    public TemplateBindingService(TemplateWorkspace workspace, BindingSettingsStore settingsStore,
                                  VariableRegistry registry, ObjectMapper objectMapper) {
        this.workspace = workspace;
        this.settingsStore = settingsStore;
        this.registry = registry;
        this.objectMapper = objectMapper;
        this.settings = settingsStore.loadOrDefault();
    }

    public VariableRegistry getRegistry() {
        return registry;
    }

    public BindingSettings getSettings() {
        return settings;
    }

    public synchronized BindingSettings updateSettings(BindingSettings updated) throws IOException {
        if (updated == null) {
            throw new IllegalArgumentException("Settings body is required");
        }
        updated.validate();
        settingsStore.save(updated);
        this.settings = updated;
        AppLogger.get().info("Binding settings updated");
        return updated;
    }

    public ExpressionSynthesizer synthesizer() {
        return new ExpressionSynthesizer(registry, settings.toExpressionConfig());
    }

    ProjectAnalyzer analyzer() {
        BindingSettings current = settings;
        return new ProjectAnalyzer(
            new LayerMatcher(registry, current.getPatternLookup()),
            new ExpressionSynthesizer(registry, current.toExpressionConfig()),
            current.getLogoMaxWidth(),
            current.getLogoMaxHeight());
    }

    public List<ExpressionRecommendation> analyze(String path, Double minConfidence) throws IOException {
        AepxDocument document = AepxDocument.load(workspace.resolveExisting(path));
        return analyzer().analyze(document, effectiveMinConfidence(minConfidence));
    }

    /**
     * Writes every recommendation at or above {@code minConfidence} into the template and
     * saves it, in place or to {@code outputPath}.
     */
    public synchronized ApplyOutcome apply(String path, Double minConfidence, String outputPath) throws IOException {
        Path source = workspace.resolveExisting(path);
        AepxDocument document = AepxDocument.load(source);
        List<ExpressionRecommendation> recommendations =
            analyzer().analyze(document, effectiveMinConfidence(minConfidence));
        List<LayerExpression> expressions = recommendations.stream()
            .map(ExpressionRecommendation::toLayerExpression)
            .collect(Collectors.toList());

        ExpressionWriter writer = new ExpressionWriter(document, objectMapper);
        BatchWriteResult batch = writer.addMultiple(expressions, true, false);
        String diff = writer.previewDiff();
        Path target = outputPath != null && !outputPath.isBlank() ? workspace.resolvePath(outputPath) : source;
        ExportResult saved = writer.saveToFile(target);
        AppLogger.get().info("Applied " + batch.getSuccesses().size() + " of " + recommendations.size()
            + " recommendations to " + workspace.relativize(target));
        return new ApplyOutcome(recommendations.size(), batch, saved, diff);
    }

    public ExpressionListing listExpressions(String path, String compName) throws IOException {
        return ExpressionWriter.open(workspace.resolveExisting(path)).findWithExpressions(compName);
    }

    /**
     * Adds one expression and saves the template when the write succeeded.
     */
    public synchronized ExpressionWriteResult addExpression(String path, String compName, String layerName,
                                                            ExpressionTarget target, String expression,
                                                            boolean validate) throws IOException {
        ExpressionWriter writer = ExpressionWriter.open(workspace.resolveExisting(path));
        ExpressionWriteResult result = writer.addExpression(compName, layerName, target, expression, validate);
        return result.isSuccess() ? saveOrFail(writer, result) : result;
    }

    public synchronized ExpressionWriteResult removeExpression(String path, String compName, String layerName,
                                                               ExpressionTarget target) throws IOException {
        ExpressionWriter writer = ExpressionWriter.open(workspace.resolveExisting(path));
        ExpressionWriteResult result = writer.removeExpression(compName, layerName, target);
        return result.isSuccess() ? saveOrFail(writer, result) : result;
    }

    public ExportResult exportExpressions(String path, String outputPath, String compName) throws IOException {
        if (outputPath == null || outputPath.isBlank()) {
            throw new IllegalArgumentException("outputPath is required");
        }
        ExpressionWriter writer = ExpressionWriter.open(workspace.resolveExisting(path));
        return writer.exportToJson(workspace.resolvePath(outputPath), compName);
    }

    public synchronized StoreCompositionOutcome generateStoreComposition(String outputPath) throws IOException {
        if (outputPath == null || outputPath.isBlank()) {
            throw new IllegalArgumentException("outputPath is required");
        }
        VariableStoreCompositionGenerator generator = new VariableStoreCompositionGenerator(registry,
            VariableStoreCompositionGenerator.DEFAULT_WIDTH, VariableStoreCompositionGenerator.DEFAULT_HEIGHT);
        StoreComposition composition = generator.generate(settings.getStoreCompositionName());
        StoreValidationResult validation = generator.validate(composition);
        if (!validation.isValid()) {
            return new StoreCompositionOutcome(null, composition.layers().size(), validation);
        }
        Path target = workspace.resolvePath(outputPath);
        generator.toDocument(composition).writeTo(target);
        AppLogger.get().info("Wrote store composition '" + composition.name() + "' to " + workspace.relativize(target));
        return new StoreCompositionOutcome(workspace.relativize(target), composition.layers().size(), validation);
    }

    private ExpressionWriteResult saveOrFail(ExpressionWriter writer, ExpressionWriteResult result) {
        ExportResult saved = writer.saveToFile(null);
        return saved.isSuccess() ? result : ExpressionWriteResult.failure(saved.getMessage());
    }

    private double effectiveMinConfidence(Double minConfidence) {
        return minConfidence != null ? minConfidence : settings.getMinConfidence();
    }

    public record ApplyOutcome(int recommended, BatchWriteResult batch, ExportResult save, String diff) {}

    public record StoreCompositionOutcome(String outputPath, int layerCount, StoreValidationResult validation) {}
}
