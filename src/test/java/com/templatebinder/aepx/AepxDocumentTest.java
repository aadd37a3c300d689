package com.templatebinder.aepx;

import org.junit.jupiter.api.Test;
import org.w3c.dom.Element;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AepxDocumentTest {

    @Test
    void prefersNamespacedElementsOverBareOnes() throws Exception {
        AepxDocument doc = AepxDocument.parse(
            "<ae:AfterEffectsProject xmlns:ae=\"" + AepxDocument.NAMESPACE + "\">"
                + "<Composition name=\"Main\"/>"
                + "<ae:Composition name=\"Main\"><ae:Layers/></ae:Composition>"
                + "</ae:AfterEffectsProject>");

        List<Element> comps = doc.compositions();
        assertEquals(1, comps.size());
        assertEquals(AepxDocument.NAMESPACE, comps.get(0).getNamespaceURI());
        assertTrue(AepxDocument.layersContainer(doc.findComposition("Main").orElseThrow()).isPresent());
    }

    @Test
    void fallsBackToBareElements() throws Exception {
        AepxDocument doc = AepxDocument.parse(
            "<AfterEffectsProject><Items><Composition name=\"A\"><Layers>"
                + "<Layer name=\"one\"/><Layer name=\"two\"/></Layers></Composition></Items></AfterEffectsProject>");

        Element comp = doc.findComposition("A").orElseThrow();
        assertEquals(2, AepxDocument.layers(comp).size());
        assertTrue(doc.findComposition("B").isEmpty());
        assertTrue(doc.getSourcePath().isEmpty());
    }

    @Test
    void appendedChildrenInheritNamespaceAndPrefix() throws Exception {
        AepxDocument doc = AepxDocument.parse(
            "<ae:AfterEffectsProject xmlns:ae=\"" + AepxDocument.NAMESPACE + "\"><ae:Layer name=\"l\"/>"
                + "</ae:AfterEffectsProject>");
        Element layer = AepxDocument.listWithFallback(doc.getRoot(), AepxDocument.LAYER, false).get(0);

        Element property = doc.appendChild(layer, AepxDocument.PROPERTY);
        property.setAttribute(AepxDocument.NAME_ATTR, "opacity");
        doc.setCData(doc.appendChild(property, AepxDocument.EXPRESSION), "50");

        assertEquals("ae", property.getPrefix());
        assertEquals(AepxDocument.NAMESPACE, property.getNamespaceURI());
        assertTrue(doc.toXml().contains("<![CDATA[50]]>"));
        assertTrue(AepxDocument.findProperty(layer, "opacity").isPresent());
    }

    @Test
    void createdDocumentsCarryNamespace() throws Exception {
        AepxDocument doc = AepxDocument.create("AfterEffectsProject");
        doc.appendComment(doc.getRoot(), " note ");
        Element comp = doc.appendChild(doc.getRoot(), AepxDocument.COMPOSITION);
        comp.setAttribute(AepxDocument.NAME_ATTR, "Hard_Card");

        assertEquals(AepxDocument.NAMESPACE, doc.getRoot().getNamespaceURI());
        assertEquals("", doc.getOriginalXml());
        assertTrue(doc.findComposition("Hard_Card").isPresent());
        assertTrue(doc.toXml().contains("<!-- note -->"));
    }

    @Test
    void nameOfFallsBackWhenAttributeMissing() throws Exception {
        AepxDocument doc = AepxDocument.parse("<Composition/>");
        assertEquals("Unknown", AepxDocument.nameOf(doc.getRoot(), "Unknown"));
    }

    @Test
    void malformedXmlFailsWithoutWritingToStderr() {
        PrintStream savedErr = System.err;
        ByteArrayOutputStream captured = new ByteArrayOutputStream();
        System.setErr(new PrintStream(captured, true, StandardCharsets.UTF_8));
        try {
            DocumentParseException e = assertThrows(DocumentParseException.class,
                () -> AepxDocument.parse("<AfterEffectsProject><Composition></AfterEffectsProject>"));
            assertTrue(e.getMessage().startsWith("Failed to parse AEPX XML"), e.getMessage());
        } finally {
            System.setErr(savedErr);
        }
        assertEquals("", captured.toString(StandardCharsets.UTF_8));
    }
}
