package com.templatebinder.aepx;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.templatebinder.expressions.ExpressionTarget;
import com.templatebinder.models.LayerExpression;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.w3c.dom.Element;

import java.io.FileNotFoundException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionWriterTest {

    private static final String LINK = "comp(\"Hard_Card\").layer(\"zhomeTeamName\").text.sourceText";

    @TempDir
    Path tempDir;

    private Path template;
    private ExpressionWriter writer;

    @BeforeEach
    void setUp() throws Exception {
        template = copyFixture("namespaced.aepx");
        writer = ExpressionWriter.open(template);
    }

    @Test
    void addsExpressionAndCreatesProperty() {
        ExpressionWriteResult result = writer.addExpression("Main", "homeTeamName", ExpressionTarget.TEXT_SOURCE, LINK);

        assertTrue(result.isSuccess());
        assertEquals("Expression added successfully to homeTeamName", result.getMessage());
        assertEquals("Main", result.getComposition());
        assertEquals("sourceText", result.getProperty());

        List<ExpressionEntry> entries = writer.findWithExpressions("Main").getLayers();
        assertTrue(entries.contains(new ExpressionEntry("Main", "homeTeamName", "sourceText", LINK)));
    }

    @Test
    void writingTwiceOverwritesInPlace() {
        writer.addExpression("Main", "homeTeamName", ExpressionTarget.OPACITY, "100");
        writer.addExpression("Main", "homeTeamName", ExpressionTarget.OPACITY, "foo(1,2)");

        Element layer = layer("Main", "homeTeamName");
        Element property = AepxDocument.findProperty(layer, "opacity").orElseThrow();
        assertEquals(1, AepxDocument.properties(layer).size());
        assertEquals(1, AepxDocument.listWithFallback(property, AepxDocument.EXPRESSION, false).size());
        assertTrue(writer.findWithExpressions("Main").getLayers()
            .contains(new ExpressionEntry("Main", "homeTeamName", "opacity", "foo(1,2)")));
    }

    @Test
    void reusesExistingPropertyAndExpression() {
        writer.addExpression("Main", "awayTeamName", ExpressionTarget.TEXT_SOURCE, "\"Away\"");

        Element layer = layer("Main", "awayTeamName");
        assertEquals(1, AepxDocument.properties(layer).size());
        Element property = AepxDocument.findProperty(layer, "sourceText").orElseThrow();
        assertEquals(1, AepxDocument.listWithFallback(property, AepxDocument.EXPRESSION, false).size());
        assertEquals("\"Away\"", AepxDocument.findExpression(property).orElseThrow().getTextContent());
    }

    @Test
    void stripsCDataMarkersFromInput() {
        writer.addExpression("Main", "homeTeamName", ExpressionTarget.OPACITY, "<![CDATA[value * 2]]>");

        Element property = AepxDocument.findProperty(layer("Main", "homeTeamName"), "opacity").orElseThrow();
        assertEquals("value * 2", AepxDocument.findExpression(property).orElseThrow().getTextContent());
    }

    @Test
    void missingCompositionOrLayerIsNotFound() {
        ExpressionWriteResult noComp = writer.addExpression("Nope", "homeTeamName", ExpressionTarget.OPACITY, "0");
        assertFalse(noComp.isSuccess());
        assertEquals(NotFoundLevel.COMPOSITION, noComp.getMissingLevel());
        assertEquals("Composition not found: Nope", noComp.getMessage());

        ExpressionWriteResult noLayer = writer.addExpression("Main", "ghost", ExpressionTarget.OPACITY, "0");
        assertEquals(NotFoundLevel.LAYER, noLayer.getMissingLevel());
        assertEquals("Layer not found: ghost in Main", noLayer.getMessage());
    }

    @Test
    void invalidExpressionLeavesDocumentUntouched() {
        String before = writer.toString();

        ExpressionWriteResult result = writer.addExpression("Main", "homeTeamName", ExpressionTarget.OPACITY,
            "var x = 5;)");

        assertFalse(result.isSuccess());
        assertFalse(result.isNotFound());
        assertEquals(List.of("Unbalanced parentheses: -1 unclosed"), result.getErrors());
        assertEquals("Expression syntax validation failed: Unbalanced parentheses: -1 unclosed", result.getMessage());
        assertEquals(before, writer.toString());
        assertEquals(0, writer.getStatistics().expressionsAdded());
    }

    @Test
    void validationCanBeSkipped() {
        ExpressionWriteResult result = writer.addExpression("Main", "homeTeamName", ExpressionTarget.OPACITY,
            "var x = 5;)", false);
        assertTrue(result.isSuccess());
    }

    @Test
    void removeReportsFirstMissingLevel() {
        assertEquals(NotFoundLevel.COMPOSITION,
            writer.removeExpression("Nope", "homeTeamName", ExpressionTarget.OPACITY).getMissingLevel());
        assertEquals("Layer not found: ghost",
            writer.removeExpression("Main", "ghost", ExpressionTarget.OPACITY).getMessage());

        ExpressionWriteResult noProperty = writer.removeExpression("Main", "homeTeamName", ExpressionTarget.OPACITY);
        assertEquals(NotFoundLevel.PROPERTY, noProperty.getMissingLevel());
        assertEquals("Property not found: opacity on layer homeTeamName", noProperty.getMessage());

        ExpressionWriteResult noExpression = writer.removeExpression("Hard_Card", "zhomeTeamName",
            ExpressionTarget.TEXT_SOURCE);
        assertEquals(NotFoundLevel.EXPRESSION, noExpression.getMissingLevel());
        assertEquals("No expression found on zhomeTeamName/sourceText", noExpression.getMessage());
    }

    @Test
    void removeDeletesOnlyTheExpression() {
        ExpressionWriteResult result = writer.removeExpression("Main", "awayTeamName", ExpressionTarget.TEXT_SOURCE);

        assertTrue(result.isSuccess());
        assertEquals("Expression removed from awayTeamName", result.getMessage());
        Element layer = layer("Main", "awayTeamName");
        Element property = AepxDocument.findProperty(layer, "sourceText").orElseThrow();
        assertTrue(AepxDocument.findExpression(property).isEmpty());
        assertEquals(0, writer.findWithExpressions().getCount());
    }

    @Test
    void batchWithoutStopReportsPartialSuccess() {
        BatchWriteResult result = writer.addMultiple(List.of(
            new LayerExpression("Main", "homeTeamName", ExpressionTarget.TEXT_SOURCE, LINK),
            new LayerExpression("Main", "ghost", ExpressionTarget.OPACITY, "0"),
            new LayerExpression("Main", "Background", ExpressionTarget.OPACITY, "50")
        ), true, false);

        assertTrue(result.isSuccess());
        assertFalse(result.isAllSucceeded());
        assertFalse(result.isStoppedEarly());
        assertEquals(List.of("homeTeamName", "Background"), result.getSuccesses());
        assertEquals(1, result.getFailures().size());
        assertEquals("ghost", result.getFailures().get(0).layer());
        assertEquals("2 succeeded, 1 failed", result.getMessage());
    }

    @Test
    void batchStopsAtFirstFailure() {
        BatchWriteResult result = writer.addMultiple(List.of(
            new LayerExpression("Main", "homeTeamName", ExpressionTarget.TEXT_SOURCE, LINK),
            new LayerExpression("Main", "ghost", ExpressionTarget.OPACITY, "0"),
            new LayerExpression("Main", "Background", ExpressionTarget.OPACITY, "50")
        ), true, true);

        assertFalse(result.isSuccess());
        assertTrue(result.isStoppedEarly());
        assertEquals(List.of("homeTeamName"), result.getSuccesses());
        assertEquals("Stopped after 1 successes, 1 failure", result.getMessage());
        assertTrue(AepxDocument.properties(layer("Main", "Background")).isEmpty());
    }

    @Test
    void emptyBatchSucceeds() {
        BatchWriteResult result = writer.addMultiple(List.of(), true, true);
        assertTrue(result.isSuccess());
        assertEquals("All 0 expressions added successfully", result.getMessage());
    }

    @Test
    void listsAcrossAllCompositions() {
        ExpressionListing listing = writer.findWithExpressions();
        assertTrue(listing.isSuccess());
        assertEquals(1, listing.getCount());
        assertEquals("Found 1 layers with expressions", listing.getMessage());
        assertEquals(new ExpressionEntry("Main", "awayTeamName", "sourceText",
                "comp(\"Hard_Card\").layer(\"zawayTeamName\").text.sourceText"),
            listing.getLayers().get(0));

        assertEquals(0, writer.findWithExpressions("Hard_Card").getCount());
        assertFalse(writer.findWithExpressions("Nope").isSuccess());
    }

    @Test
    void worksOnDocumentsWithoutNamespace() throws Exception {
        ExpressionWriter bare = ExpressionWriter.open(copyFixture("bare.aepx"));
        ExpressionWriteResult result = bare.addExpression("Lower_Third", "txt_awayTeamScore1",
            ExpressionTarget.TEXT_SOURCE, "foo(1,2)");

        assertTrue(result.isSuccess());
        assertEquals(List.of(new ExpressionEntry("Lower_Third", "txt_awayTeamScore1", "sourceText", "foo(1,2)")),
            bare.findWithExpressions().getLayers());
        assertTrue(bare.toString().contains("<![CDATA[foo(1,2)]]>"));
    }

    @Test
    void savesAndReloads() throws Exception {
        writer.addExpression("Main", "homeTeamName", ExpressionTarget.TEXT_SOURCE, "foo(1,2)");
        Path out = tempDir.resolve("out/saved.aepx");

        ExportResult saved = writer.saveToFile(out);
        assertTrue(saved.isSuccess());
        assertEquals("Saved to " + out, saved.getMessage());

        ExpressionWriter reloaded = ExpressionWriter.open(out);
        assertTrue(reloaded.findWithExpressions("Main").getLayers()
            .contains(new ExpressionEntry("Main", "homeTeamName", "sourceText", "foo(1,2)")));
    }

    @Test
    void saveWithoutPathOverwritesSource() throws Exception {
        writer.addExpression("Main", "Background", ExpressionTarget.OPACITY, "50");
        assertTrue(writer.saveToFile(null).isSuccess());
        assertTrue(Files.readString(template).contains("<![CDATA[50]]>"));
    }

    @Test
    void saveWithoutAnyPathFails() throws Exception {
        ExpressionWriter inMemory = ExpressionWriter.fromXml(Files.readString(template));
        ExportResult result = inMemory.saveToFile(null);
        assertFalse(result.isSuccess());
        assertEquals("No output path specified and no original file path", result.getMessage());
    }

    @Test
    void exportsListingAsJson() throws Exception {
        Path out = tempDir.resolve("export/expressions.json");

        ExportResult result = writer.exportToJson(out, null);

        assertTrue(result.isSuccess());
        assertEquals(1, result.getCount());
        assertEquals("Exported 1 expressions", result.getMessage());
        JsonNode json = new ObjectMapper().readTree(out.toFile());
        assertEquals(1, json.get("count").asInt());
        assertEquals("awayTeamName", json.get("layers").get(0).get("layer").asText());
        assertEquals("sourceText", json.get("layers").get(0).get("property").asText());
        assertFalse(json.has("success"));

        assertFalse(writer.exportToJson(tempDir.resolve("x.json"), "Nope").isSuccess());
    }

    @Test
    void statisticsCountAddsAndRemovesByComposition() {
        writer.addExpression("Main", "homeTeamName", ExpressionTarget.OPACITY, "100");
        writer.addExpression("Main", "Background", ExpressionTarget.OPACITY, "100");
        writer.addExpression("Hard_Card", "zhomeTeamName", ExpressionTarget.OPACITY, "100");
        writer.removeExpression("Main", "awayTeamName", ExpressionTarget.TEXT_SOURCE);

        WriterStatistics stats = writer.getStatistics();
        assertEquals(3, stats.expressionsAdded());
        assertEquals(1, stats.expressionsRemoved());
        assertEquals(2, stats.addedByComp().get("Main"));
        assertEquals(1, stats.addedByComp().get("Hard_Card"));
        assertEquals(1, stats.removedByComp().get("Main"));
    }

    @Test
    void previewDiffShowsNewExpression() {
        writer.addExpression("Main", "homeTeamName", ExpressionTarget.OPACITY, "foo(1,2)");
        String diff = writer.previewDiff();
        assertTrue(diff.startsWith("--- " + template));
        assertTrue(diff.contains("foo(1,2)"));
    }

    @Test
    void rejectsMalformedAndMissingDocuments() {
        assertThrows(DocumentParseException.class, () -> ExpressionWriter.fromXml("<a><b></a>"));
        assertThrows(DocumentParseException.class, () -> ExpressionWriter.fromXml(""));
        assertThrows(FileNotFoundException.class, () -> ExpressionWriter.open(tempDir.resolve("missing.aepx")));
    }

    @Test
    void stripCDataHandlesNull() {
        assertEquals("", ExpressionWriter.stripCData(null));
        assertEquals("x", ExpressionWriter.stripCData("<![CDATA[x]]>"));
    }

    private Element layer(String comp, String layer) {
        Element composition = writer.getDocument().findComposition(comp).orElseThrow();
        Element container = AepxDocument.layersContainer(composition).orElseThrow();
        return AepxDocument.findLayer(container, layer).orElseThrow();
    }

    private Path copyFixture(String name) throws Exception {
        Path target = tempDir.resolve(name);
        try (InputStream is = getClass().getResourceAsStream("/templates/" + name)) {
            assertNotNull(is, "missing fixture " + name);
            Files.copy(is, target);
        }
        return target;
    }
}
