package com.templatebinder.matching;

import com.templatebinder.AppLogger;
import com.templatebinder.variables.VariableDefinition;
import com.templatebinder.variables.VariableRegistry;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Classifies a layer name against the variable catalog.
 * Strategies run in order (exact, pattern, fuzzy) and the first hit wins.
 */
public class LayerMatcher {

    public static final double FUZZY_THRESHOLD = 0.7;

    private final VariableRegistry registry;
    private final PatternLookupMode lookupMode;
    private final List<LayerPattern> patterns;
    private final Map<String, VariableDefinition> byLowerName;
    private final Map<String, VariableDefinition> byLowerStoreName;
    private final AppLogger logger = AppLogger.get();

    public LayerMatcher(VariableRegistry registry, PatternLookupMode lookupMode) {
        this.registry = registry != null ? registry : VariableRegistry.standard();
        this.lookupMode = lookupMode != null ? lookupMode : PatternLookupMode.CAMEL_CASE;
        this.patterns = LayerPatternTables.dispatchOrder(this.lookupMode);

        Map<String, VariableDefinition> names = new HashMap<>();
        Map<String, VariableDefinition> storeNames = new HashMap<>();
        for (VariableDefinition variable : this.registry.getAll()) {
            names.put(variable.getName().toLowerCase(Locale.ROOT), variable);
            storeNames.put(variable.getStoreName().toLowerCase(Locale.ROOT), variable);
        }
        this.byLowerName = Collections.unmodifiableMap(names);
        this.byLowerStoreName = Collections.unmodifiableMap(storeNames);
    }

    public LayerMatcher() {
        this(VariableRegistry.standard(), PatternLookupMode.CAMEL_CASE);
    }

    public Optional<VariableMatch> match(String layerName) {
        if (layerName == null || layerName.isEmpty()) {
            return Optional.empty();
        }
        Optional<VariableMatch> result = matchExact(layerName);
        if (result.isEmpty()) {
            result = matchPattern(layerName);
        }
        if (result.isEmpty()) {
            result = matchFuzzy(layerName);
        }
        if (result.isPresent()) {
            logger.debug("Matched layer '" + layerName + "' -> " + result.get());
        }
        return result;
    }

    public Optional<VariableMatch> matchExact(String layerName) {
        String normalized = LayerNameNormalizer.normalize(layerName);
        VariableDefinition variable = lookupLowercase(normalized);
        if (variable == null) {
            return Optional.empty();
        }
        return Optional.of(new VariableMatch(variable, MatchConfidence.EXACT.getValue(),
            "Exact name match", MatchStrategy.EXACT));
    }

    /**
     * Tests the raw layer name against the pattern tables; a matching pattern only counts
     * when the derived catalog key resolves.
     */
    public Optional<VariableMatch> matchPattern(String layerName) {
        if (layerName == null || layerName.isEmpty()) {
            return Optional.empty();
        }
        for (LayerPattern pattern : patterns) {
            if (!pattern.matches(layerName)) {
                continue;
            }
            VariableDefinition variable = resolvePatternCandidate(layerName);
            if (variable != null) {
                return Optional.of(new VariableMatch(variable, pattern.getBaseConfidence(),
                    "Matched " + pattern.getCategory() + " pattern: " + pattern.getRegex(),
                    MatchStrategy.PATTERN));
            }
        }
        return Optional.empty();
    }

    public Optional<VariableMatch> matchFuzzy(String layerName) {
        String normalized = LayerNameNormalizer.normalize(layerName);
        VariableDefinition best = null;
        double bestScore = 0.0;
        for (VariableDefinition variable : registry.getAll()) {
            double score = LayerNameNormalizer.similarity(normalized, variable.getName().toLowerCase(Locale.ROOT));
            if (score > FUZZY_THRESHOLD && score > bestScore) {
                bestScore = score;
                best = variable;
            }
        }
        if (best == null) {
            return Optional.empty();
        }
        String reason = String.format(Locale.ROOT, "Fuzzy match (similarity: %.0f%%)", bestScore * 100);
        return Optional.of(new VariableMatch(best, fuzzyConfidence(bestScore).getValue(), reason, MatchStrategy.FUZZY));
    }

    static MatchConfidence fuzzyConfidence(double similarity) {
        if (similarity >= 0.95) {
            return MatchConfidence.HIGH;
        } else if (similarity >= 0.85) {
            return MatchConfidence.GOOD;
        } else if (similarity >= 0.75) {
            return MatchConfidence.MEDIUM;
        }
        return MatchConfidence.LOW;
    }

    private VariableDefinition resolvePatternCandidate(String layerName) {
        if (lookupMode == PatternLookupMode.NORMALIZED) {
            VariableDefinition variable = lookupLowercase(LayerNameNormalizer.stripSeparators(layerName));
            return variable != null ? variable : lookupLowercase(LayerNameNormalizer.compact(layerName));
        }
        // camelCase assumption: only the first character is lower-cased
        String candidate = layerName.substring(0, 1).toLowerCase(Locale.ROOT) + layerName.substring(1);
        return registry.getByName(candidate).orElse(null);
    }

    private VariableDefinition lookupLowercase(String key) {
        VariableDefinition variable = byLowerName.get(key);
        return variable != null ? variable : byLowerStoreName.get(key);
    }
}
