package com.templatebinder.aepx;

import com.templatebinder.AppLogger;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * A parsed template document.
 * <pre>
 * AfterEffectsProject
 *   Composition[name]
 *     Layers
 *       Layer[name, type]
 *         Property[name]
 *           Expression (CDATA)
 * </pre>
 * Source files use the After Effects namespace inconsistently, so every lookup tries the
 * namespaced element first and falls back to the bare element name.
 * <p>
 * The DOM is mutable and not thread-safe; use one instance per document and caller.
 */
public class AepxDocument {

    public static final String NAMESPACE = "http://www.adobe.com/products/aftereffects";

    public static final String COMPOSITION = "Composition";
    public static final String LAYERS = "Layers";
    public static final String LAYER = "Layer";
    public static final String PROPERTY = "Property";
    public static final String EXPRESSION = "Expression";
    public static final String NAME_ATTR = "name";
    public static final String TYPE_ATTR = "type";

    private final Document document;
    private final Path sourcePath;
    private final String originalXml;

    private AepxDocument(Document document, Path sourcePath, String originalXml) {
        this.document = document;
        this.sourcePath = sourcePath;
        this.originalXml = originalXml;
    }

    public static AepxDocument load(Path path) throws IOException {
        if (path == null || !Files.isRegularFile(path)) {
            AppLogger.get().error("AEPX file not found: " + path);
            throw new FileNotFoundException("AEPX file not found: " + path);
        }
        String xml = Files.readString(path, StandardCharsets.UTF_8);
        AepxDocument doc = new AepxDocument(parseDom(xml, path.toString()), path, xml);
        AppLogger.get().info("Loaded AEPX file: " + path);
        return doc;
    }

    public static AepxDocument parse(String xml) throws DocumentParseException {
        AepxDocument doc = new AepxDocument(parseDom(xml, "XML string"), null, xml);
        AppLogger.get().info("Loaded AEPX from XML string");
        return doc;
    }

    /**
     * A new, empty document whose root element carries the After Effects namespace.
     */
    public static AepxDocument create(String rootTag) throws DocumentParseException {
        Document dom = newDocumentBuilder().newDocument();
        dom.appendChild(dom.createElementNS(NAMESPACE, rootTag));
        return new AepxDocument(dom, null, "");
    }

    private static Document parseDom(String xml, String source) throws DocumentParseException {
        if (xml == null || xml.isBlank()) {
            throw new DocumentParseException("Failed to parse AEPX XML (" + source + "): document is empty", null);
        }
        try {
            DocumentBuilder builder = newDocumentBuilder();
            return builder.parse(new InputSource(new StringReader(xml)));
        } catch (SAXException | IOException e) {
            AppLogger.get().error("Failed to parse AEPX XML (" + source + "): " + e.getMessage());
            throw new DocumentParseException("Failed to parse AEPX XML (" + source + "): " + e.getMessage(), e);
        }
    }

    static DocumentBuilder newDocumentBuilder() throws DocumentParseException {
        try {
            DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
            dbf.setNamespaceAware(true);
            dbf.setValidating(false);
            dbf.setXIncludeAware(false);
            dbf.setExpandEntityReferences(false);
            dbf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            dbf.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            dbf.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
            DocumentBuilder builder = dbf.newDocumentBuilder();
            // Keep parse errors out of stderr; they surface as exceptions.
            builder.setErrorHandler(new ErrorHandler() {
                @Override
                public void warning(SAXParseException e) {
                    AppLogger.get().debug("AEPX parser warning: " + e.getMessage());
                }

                @Override
                public void error(SAXParseException e) throws SAXException {
                    throw e;
                }

                @Override
                public void fatalError(SAXParseException e) throws SAXException {
                    throw e;
                }
            });
            return builder;
        } catch (ParserConfigurationException e) {
            throw new DocumentParseException("XML parser unavailable: " + e.getMessage(), e);
        }
    }

    public Element getRoot() {
        return document.getDocumentElement();
    }

    public Optional<Path> getSourcePath() {
        return Optional.ofNullable(sourcePath);
    }

    /**
     * The XML text the document was created from, for diffing against the current state.
     */
    public String getOriginalXml() {
        return originalXml != null ? originalXml : "";
    }

    // -------------------------------------------------------------------------
    // Lookups
    // -------------------------------------------------------------------------

    /**
     * All compositions anywhere in the document: the namespaced ones, or the bare ones
     * when the document has no namespaced compositions.
     */
    public List<Element> compositions() {
        return listWithFallback(getRoot(), COMPOSITION, true);
    }

    public Optional<Element> findComposition(String name) {
        return findWithFallback(getRoot(), COMPOSITION, true, byName(name));
    }

    public static Optional<Element> layersContainer(Element composition) {
        return findWithFallback(composition, LAYERS, false, e -> true);
    }

    public static List<Element> layers(Element composition) {
        return layersContainer(composition)
            .map(container -> listWithFallback(container, LAYER, false))
            .orElseGet(List::of);
    }

    public static Optional<Element> findLayer(Element layersContainer, String name) {
        return findWithFallback(layersContainer, LAYER, false, byName(name));
    }

    public static List<Element> properties(Element layer) {
        return listWithFallback(layer, PROPERTY, false);
    }

    public static Optional<Element> findProperty(Element layer, String name) {
        return findWithFallback(layer, PROPERTY, false, byName(name));
    }

    public static Optional<Element> findExpression(Element property) {
        return findWithFallback(property, EXPRESSION, false, e -> true);
    }

    public static String nameOf(Element element, String fallback) {
        String name = element.getAttribute(NAME_ATTR);
        return name == null || name.isEmpty() ? fallback : name;
    }

    /**
     * First element named {@code tag} under {@code parent} that passes {@code test}, searching
     * namespaced elements before bare ones.
     */
    public static Optional<Element> findWithFallback(Element parent, String tag, boolean deep,
                                                     Predicate<Element> test) {
        if (parent == null) {
            return Optional.empty();
        }
        for (Element element : elements(parent, tag, NAMESPACE, deep)) {
            if (test.test(element)) {
                return Optional.of(element);
            }
        }
        for (Element element : elements(parent, tag, null, deep)) {
            if (test.test(element)) {
                return Optional.of(element);
            }
        }
        return Optional.empty();
    }

    public static List<Element> listWithFallback(Element parent, String tag, boolean deep) {
        if (parent == null) {
            return List.of();
        }
        List<Element> namespaced = elements(parent, tag, NAMESPACE, deep);
        return !namespaced.isEmpty() ? namespaced : elements(parent, tag, null, deep);
    }

    private static Predicate<Element> byName(String name) {
        return e -> name != null && name.equals(e.getAttribute(NAME_ATTR));
    }

    private static List<Element> elements(Element parent, String tag, String namespace, boolean deep) {
        List<Element> found = new ArrayList<>();
        collect(parent, tag, namespace, deep, found);
        return found;
    }

    private static void collect(Element parent, String tag, String namespace, boolean deep, List<Element> out) {
        NodeList children = parent.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node node = children.item(i);
            if (node.getNodeType() != Node.ELEMENT_NODE) {
                continue;
            }
            Element child = (Element) node;
            if (matches(child, tag, namespace)) {
                out.add(child);
            }
            if (deep) {
                collect(child, tag, namespace, true, out);
            }
        }
    }

    private static boolean matches(Element element, String tag, String namespace) {
        String localName = element.getLocalName() != null ? element.getLocalName() : element.getTagName();
        if (!tag.equals(localName)) {
            return false;
        }
        String elementNs = element.getNamespaceURI();
        if (namespace == null) {
            return elementNs == null || elementNs.isEmpty();
        }
        return namespace.equals(elementNs);
    }

    // -------------------------------------------------------------------------
    // Mutation helpers
    // -------------------------------------------------------------------------

    /**
     * Appends a child element that shares the parent's namespace and prefix.
     */
    public Element appendChild(Element parent, String tag) {
        String ns = parent.getNamespaceURI();
        Element child;
        if (ns == null || ns.isEmpty()) {
            child = document.createElement(tag);
        } else {
            String prefix = parent.getPrefix();
            child = document.createElementNS(ns, prefix != null ? prefix + ":" + tag : tag);
        }
        parent.appendChild(child);
        return child;
    }

    public void appendComment(Element parent, String text) {
        parent.appendChild(document.createComment(text));
    }

    /**
     * Replaces the element's content with a single CDATA section.
     */
    public void setCData(Element element, String text) {
        while (element.getFirstChild() != null) {
            element.removeChild(element.getFirstChild());
        }
        element.appendChild(document.createCDATASection(text));
    }

    // -------------------------------------------------------------------------
    // Serialization
    // -------------------------------------------------------------------------

    public String toXml() {
        return serialize(document);
    }

    private static String serialize(Document document) {
        StringWriter writer = new StringWriter();
        try {
            newTransformer().transform(new DOMSource(document), new StreamResult(writer));
        } catch (TransformerException e) {
            throw new IllegalStateException("Failed to serialize AEPX document: " + e.getMessage(), e);
        }
        return writer.toString();
    }

    public void writeTo(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try {
            newTransformer().transform(new DOMSource(document), new StreamResult(path.toFile()));
        } catch (TransformerException e) {
            throw new IOException("Failed to write AEPX document to " + path + ": " + e.getMessage(), e);
        }
    }

    private static Transformer newTransformer() throws TransformerException {
        TransformerFactory tf = TransformerFactory.newInstance();
        Transformer transformer = tf.newTransformer();
        transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
        transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "no");
        return transformer;
    }
}
