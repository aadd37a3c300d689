package com.templatebinder.analysis;

import com.templatebinder.AppLogger;
import com.templatebinder.aepx.AepxDocument;
import com.templatebinder.expressions.ExpressionSynthesizer;
import com.templatebinder.expressions.ExpressionTarget;
import com.templatebinder.expressions.ScaleMode;
import com.templatebinder.matching.LayerKind;
import com.templatebinder.matching.LayerMatcher;
import com.templatebinder.matching.MatchConfidence;
import com.templatebinder.matching.TargetResolver;
import com.templatebinder.matching.VariableMatch;
import com.templatebinder.models.ExpressionRecommendation;
import com.templatebinder.variables.VariableDefinition;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Walks every composition of a template and recommends a binding for each layer it can
 * match: matcher, then target resolver, then synthesizer.
 */
public class ProjectAnalyzer {

    public static final double DEFAULT_MIN_CONFIDENCE = 0.6;
    static final int EXPORT_EXPRESSION_LIMIT = 100;

    private static final String STATUS_VARIABLE = "statusText";

    private final LayerMatcher matcher;
    private final ExpressionSynthesizer synthesizer;
    private final int logoMaxWidth;
    private final int logoMaxHeight;

    public ProjectAnalyzer(LayerMatcher matcher, ExpressionSynthesizer synthesizer,
                           int logoMaxWidth, int logoMaxHeight) {
        this.matcher = matcher;
        this.synthesizer = synthesizer;
        this.logoMaxWidth = logoMaxWidth;
        this.logoMaxHeight = logoMaxHeight;
    }

    public ProjectAnalyzer() {
        this(new LayerMatcher(), new ExpressionSynthesizer(), 500, 500);
    }

    public List<ExpressionRecommendation> analyze(AepxDocument document) {
        return analyze(document, DEFAULT_MIN_CONFIDENCE);
    }

    public List<ExpressionRecommendation> analyze(AepxDocument document, double minConfidence) {
        List<Element> comps = document.compositions();
        AppLogger.get().info("Analyzing " + comps.size() + " compositions");

        List<ExpressionRecommendation> recommendations = new ArrayList<>();
        for (Element comp : comps) {
            String compName = AepxDocument.nameOf(comp, "Unknown");
            for (Element layer : AepxDocument.layers(comp)) {
                Optional<ExpressionRecommendation> rec = analyzeLayer(compName, layer);
                if (rec.isPresent() && rec.get().getConfidence() >= minConfidence) {
                    recommendations.add(rec.get());
                    AppLogger.get().debug("Recommended: " + rec.get());
                }
            }
        }
        AppLogger.get().info(String.format(Locale.ROOT,
            "Found %d expression recommendations (min confidence: %.0f%%)",
            recommendations.size(), minConfidence * 100));
        return recommendations;
    }

    /**
     * Recommendation for one layer element, or empty when the layer is unnamed, belongs to
     * the store composition, or matches nothing.
     */
    public Optional<ExpressionRecommendation> analyzeLayer(String compName, Element layer) {
        String layerName = layer.getAttribute(AepxDocument.NAME_ATTR);
        if (layerName == null || layerName.isEmpty()) {
            return Optional.empty();
        }
        if (storeCompositionName().equals(compName)) {
            return Optional.empty();
        }
        Optional<VariableMatch> match = matcher.match(layerName);
        if (match.isEmpty()) {
            return Optional.empty();
        }
        LayerKind kind = LayerKind.fromAttribute(layer.getAttribute(AepxDocument.TYPE_ATTR));
        VariableDefinition variable = match.get().getVariable();
        ExpressionTarget target = TargetResolver.resolve(kind, variable);
        String expression = expressionFor(variable, target, layerName);
        return Optional.of(new ExpressionRecommendation(compName, layerName, kind, variable, target,
            expression, match.get().getConfidence(), match.get().getReason()));
    }

    String expressionFor(VariableDefinition variable, ExpressionTarget target, String layerName) {
        String lowerLayer = layerName.toLowerCase(Locale.ROOT);
        switch (target) {
            case TEXT_SOURCE:
                return synthesizer.textLink(variable.getName());
            case SCALE:
                if (variable.getName().toLowerCase(Locale.ROOT).contains("logo")) {
                    return synthesizer.logoScaleToFit(logoMaxWidth, logoMaxHeight);
                }
                return synthesizer.imageScaleToComp(ScaleMode.FIT);
            case COLOR:
                return synthesizer.hexColorToRgb(variable.getName());
            case OPACITY:
                if (lowerLayer.contains("final")) {
                    return synthesizer.conditionalVisibilityText(STATUS_VARIABLE, "FINAL", true);
                } else if (lowerLayer.contains("live")) {
                    return synthesizer.conditionalVisibilityText(STATUS_VARIABLE, "LIVE", true);
                }
                return synthesizer.conditionalVisibilityText(variable.getName(), "", false);
            default:
                return synthesizer.textLink(variable.getName());
        }
    }

    private String storeCompositionName() {
        return synthesizer.getConfig().getStoreCompositionName();
    }

    /**
     * Null or empty criteria are not applied.
     */
    public static List<ExpressionRecommendation> filter(List<ExpressionRecommendation> recommendations,
                                                        Double minConfidence,
                                                        Collection<LayerKind> layerKinds,
                                                        Collection<String> compositionNames) {
        return recommendations.stream()
            .filter(r -> minConfidence == null || r.getConfidence() >= minConfidence)
            .filter(r -> layerKinds == null || layerKinds.isEmpty() || layerKinds.contains(r.getLayerKind()))
            .filter(r -> compositionNames == null || compositionNames.isEmpty()
                || compositionNames.contains(r.getCompositionName()))
            .collect(Collectors.toList());
    }

    public static Map<String, List<ExpressionRecommendation>> groupByConfidenceBucket(
            List<ExpressionRecommendation> recommendations) {
        Map<String, List<ExpressionRecommendation>> groups = new LinkedHashMap<>();
        for (MatchConfidence bucket : MatchConfidence.values()) {
            groups.put(bucket.getLabel(), new ArrayList<>());
        }
        for (ExpressionRecommendation rec : recommendations) {
            groups.get(rec.getBucket().getLabel()).add(rec);
        }
        return groups;
    }

    public static List<Map<String, Object>> toExportableMaps(List<ExpressionRecommendation> recommendations) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (ExpressionRecommendation rec : recommendations) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("compName", rec.getCompositionName());
            row.put("layerName", rec.getLayerName());
            row.put("layerType", rec.getLayerKind().getValue());
            row.put("variableName", rec.getVariableName());
            row.put("target", rec.getTarget().getPropertyName());
            row.put("confidence", rec.getConfidence());
            row.put("reason", rec.getReason());
            row.put("expression", truncate(rec.getExpression()));
            rows.add(row);
        }
        return rows;
    }

    private static String truncate(String expression) {
        if (expression == null || expression.length() <= EXPORT_EXPRESSION_LIMIT) {
            return expression;
        }
        return expression.substring(0, EXPORT_EXPRESSION_LIMIT) + "...";
    }
}
