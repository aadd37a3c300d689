package com.templatebinder;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.templatebinder.aepx.AepxDocument;
import com.templatebinder.aepx.ExportResult;
import com.templatebinder.aepx.ExpressionEntry;
import com.templatebinder.aepx.ExpressionListing;
import com.templatebinder.aepx.ExpressionWriteResult;
import com.templatebinder.aepx.NotFoundLevel;
import com.templatebinder.expressions.ExpressionTarget;
import com.templatebinder.models.BindingSettings;
import com.templatebinder.models.ExpressionRecommendation;
import com.templatebinder.variables.VariableRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.FileNotFoundException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TemplateBindingServiceTest {

    @TempDir
    Path root;

    private TemplateBindingService service;

    @BeforeEach
    void setUp() throws Exception {
        try (InputStream is = getClass().getResourceAsStream("/templates/namespaced.aepx")) {
            assertNotNull(is);
            Files.copy(is, root.resolve("game.aepx"));
        }
        ObjectMapper objectMapper = new ObjectMapper();
        service = new TemplateBindingService(new TemplateWorkspace(root),
            new BindingSettingsStore(root, objectMapper), VariableRegistry.standard(), objectMapper);
    }

    @Test
    void analyzeUsesSettingsThreshold() throws Exception {
        List<ExpressionRecommendation> recs = service.analyze("game.aepx", null);
        assertEquals(4, recs.size());
        assertThrows(FileNotFoundException.class, () -> service.analyze("missing.aepx", null));
        assertThrows(SecurityException.class, () -> service.analyze("../game.aepx", null));
    }

    @Test
    void applyWritesRecommendationsToOutput() throws Exception {
        TemplateBindingService.ApplyOutcome outcome = service.apply("game.aepx", null, "out/bound.aepx");

        assertEquals(4, outcome.recommended());
        assertTrue(outcome.batch().isAllSucceeded());
        assertTrue(outcome.save().isSuccess());
        assertTrue(outcome.diff().contains("zhomeTeamName"));

        ExpressionListing listing = service.listExpressions("out/bound.aepx", "Main");
        assertEquals(4, listing.getCount());
        assertEquals(1, service.listExpressions("game.aepx", null).getCount());
    }

    @Test
    void addAndRemoveSaveInPlace() throws Exception {
        ExpressionWriteResult added = service.addExpression("game.aepx", "Main", "Background",
            ExpressionTarget.OPACITY, "50", true);
        assertTrue(added.isSuccess());
        assertTrue(service.listExpressions("game.aepx", "Main").getLayers()
            .contains(new ExpressionEntry("Main", "Background", "opacity", "50")));

        ExpressionWriteResult removed = service.removeExpression("game.aepx", "Main", "Background",
            ExpressionTarget.OPACITY);
        assertTrue(removed.isSuccess());
        assertEquals(1, service.listExpressions("game.aepx", null).getCount());
    }

    @Test
    void failedWriteLeavesFileUnchanged() throws Exception {
        String before = Files.readString(root.resolve("game.aepx"));

        ExpressionWriteResult result = service.addExpression("game.aepx", "Main", "ghost",
            ExpressionTarget.OPACITY, "50", true);

        assertEquals(NotFoundLevel.LAYER, result.getMissingLevel());
        assertEquals(before, Files.readString(root.resolve("game.aepx")));
    }

    @Test
    void exportsToWorkspacePath() throws Exception {
        ExportResult result = service.exportExpressions("game.aepx", "exports/game.json", null);
        assertTrue(result.isSuccess());
        assertTrue(Files.exists(root.resolve("exports/game.json")));
        assertThrows(IllegalArgumentException.class, () -> service.exportExpressions("game.aepx", "", null));
    }

    @Test
    void settingsChangeStoreComposition() throws Exception {
        BindingSettings settings = BindingSettings.defaults();
        settings.setStoreCompositionName("Data");
        service.updateSettings(settings);

        ExpressionRecommendation first = service.analyze("game.aepx", null).get(0);
        assertEquals("comp(\"Data\").layer(\"zhomeTeamName\").text.sourceText", first.getExpression());
        assertTrue(Files.exists(root.resolve(".template-binder/settings.json")));

        BindingSettings invalid = BindingSettings.defaults();
        invalid.setMinConfidence(-1);
        assertThrows(IllegalArgumentException.class, () -> service.updateSettings(invalid));
        assertEquals("Data", service.getSettings().getStoreCompositionName());
    }

    @Test
    void generatesStoreComposition() throws Exception {
        TemplateBindingService.StoreCompositionOutcome outcome = service.generateStoreComposition("hard_card.aepx");

        assertEquals("hard_card.aepx", outcome.outputPath());
        assertEquals(185, outcome.layerCount());
        assertTrue(outcome.validation().isValid());

        AepxDocument doc = AepxDocument.load(root.resolve("hard_card.aepx"));
        assertEquals(185, AepxDocument.layers(doc.findComposition("Hard_Card").orElseThrow()).size());
    }
}
