package com.templatebinder.store;

import com.templatebinder.aepx.AepxDocument;
import com.templatebinder.variables.VariableDefinition;
import com.templatebinder.variables.VariableRegistry;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Element;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VariableStoreCompositionGeneratorTest {

    private final VariableRegistry registry = VariableRegistry.standard();
    private final VariableStoreCompositionGenerator generator = new VariableStoreCompositionGenerator();

    @Test
    void layoutIsRowMajorGrid() {
        List<StoreLayer> layers = generator.layout(registry.getAll(), StoreLayout.defaults());

        assertEquals(185, layers.size());
        assertEquals(50, layers.get(0).x());
        assertEquals(50, layers.get(0).y());
        assertEquals(450, layers.get(1).x());
        assertEquals(50, layers.get(1).y());
        assertEquals(50, layers.get(4).x());
        assertEquals(110, layers.get(4).y());
    }

    @Test
    void layersUseStoreNamesAndDefaults() {
        StoreComposition comp = generator.generate(null);

        assertEquals("Hard_Card", comp.name());
        assertEquals(1920, comp.width());
        assertEquals(1080, comp.height());
        StoreLayer first = comp.layers().get(0);
        assertEquals(registry.getAll().get(0).getStoreName(), first.name());
        assertEquals(40, first.fontSize());
        assertEquals("Arial", first.fontFamily());
        assertEquals("1.0,1.0,1.0,1.0", first.fillColor());
    }

    @Test
    void defaultCompositionIsValidWithOverflowWarnings() {
        StoreValidationResult result = generator.validate(generator.generate("Hard_Card"));

        assertTrue(result.isValid());
        assertTrue(result.getErrors().isEmpty());
        assertFalse(result.getWarnings().isEmpty());
        assertTrue(result.getWarnings().stream().allMatch(w -> w.contains("exceeds comp height")));
    }

    @Test
    void reportsDuplicateAndUnprefixedNames() {
        VariableDefinition home = registry.require("homeTeamName");
        StoreLayout layout = StoreLayout.defaults();
        StoreComposition comp = new StoreComposition("Hard_Card", 1920, 1080, 8, 30, List.of(
            StoreLayer.of(home, 10, 10, layout),
            StoreLayer.of(home, 20, 20, layout),
            new StoreLayer(home, "homeTeamName", "", -5, 30, 40, "Arial", "1,1,1,1")));

        StoreValidationResult result = generator.validate(comp);

        assertFalse(result.isValid());
        assertEquals(List.of("Duplicate layer name: 'zhomeTeamName'",
            "Layer 2: 'homeTeamName' does not start with 'z'"), result.getErrors());
        assertTrue(result.getWarnings().contains("Layer 'homeTeamName' has negative position: (-5, 30)"));
        assertTrue(result.getWarnings().contains("Layer count 3 differs from standard variable count 185"));
        assertTrue(result.getMessage().startsWith("Validation failed: 2 error(s)"));
    }

    @Test
    void rejectsNonPositiveColumns() {
        assertThrows(IllegalArgumentException.class,
            () -> new StoreLayout(0, 50, 50, 400, 60, 40, "Arial", "1,1,1,1"));
    }

    @Test
    void documentHoldsOneTextLayerPerVariable() throws Exception {
        StoreComposition comp = generator.generate("Hard_Card");
        AepxDocument doc = generator.toDocument(comp);

        Element composition = doc.findComposition("Hard_Card").orElseThrow();
        assertEquals("1920", composition.getAttribute("width"));
        assertEquals("30", composition.getAttribute("frameRate"));
        List<Element> layers = AepxDocument.layers(composition);
        assertEquals(185, layers.size());

        Element first = layers.get(0);
        assertEquals("1", first.getAttribute("index"));
        assertEquals("text", first.getAttribute(AepxDocument.TYPE_ATTR));
        assertEquals("50,50", AepxDocument.findProperty(first, "position").orElseThrow().getAttribute("value"));
        assertEquals(5, AepxDocument.properties(first).size());

        String xml = doc.toXml();
        assertTrue(xml.contains("<!-- Variable: homeTeamName | Category: team | Type: text -->"));
    }

    @Test
    void storeLayerTextComesFromDefaultValue() {
        StoreLayer layer = StoreLayer.of(registry.require("player7Number"), 0, 0, StoreLayout.defaults());
        assertEquals("zplayer7Number", layer.name());
        assertEquals("7", layer.sourceText());
    }
}
