package com.architecture.diagram.irengine.service.svg;

import com.architecture.diagram.irengine.exception.SvgParseException;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
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
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Parses SVG text into an {@link SvgDocument} arena. External entities and DTDs are never loaded.
 */
@Slf4j
public final class SvgDocumentParser {

    private static final Set<String> TEXT_CONTENT_ELEMENTS = Set.of("text", "tspan", "textpath");

    private SvgDocumentParser() {
    }

    public static SvgDocument parse(String svgText) {
        if (svgText == null || svgText.isBlank()) {
            throw new SvgParseException("SVG input is empty", null);
        }
        Document dom;
        try {
            DocumentBuilder builder = newFactory().newDocumentBuilder();
            builder.setErrorHandler(new RaisingErrorHandler());
            dom = builder.parse(new InputSource(new StringReader(svgText)));
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser is not configurable", e);
        } catch (SAXException | IOException e) {
            throw new SvgParseException("Malformed SVG: " + e.getMessage(), e);
        }

        List<SvgElement> elements = new ArrayList<>();
        collect(dom.getDocumentElement(), -1, elements);
        return new SvgDocument(elements);
    }

    private static int collect(Element element, int parentIndex, List<SvgElement> out) {
        int index = out.size();
        out.add(null);

        Map<String, String> attributes = new LinkedHashMap<>();
        NamedNodeMap attrs = element.getAttributes();
        for (int i = 0; i < attrs.getLength(); i++) {
            Attr attr = (Attr) attrs.item(i);
            attributes.put(attr.getName(), attr.getValue());
        }

        String localName = element.getLocalName() != null ? element.getLocalName()
                : SvgElement.stripPrefix(element.getTagName());
        boolean keepWhitespace = TEXT_CONTENT_ELEMENTS.contains(localName.toLowerCase(Locale.ROOT));

        // leading text, then one tail per child element
        StringBuilder text = new StringBuilder();
        List<Integer> childIndexes = new ArrayList<>();
        List<StringBuilder> tails = new ArrayList<>();
        NodeList children = element.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node child = children.item(i);
            short type = child.getNodeType();
            if (type == Node.ELEMENT_NODE) {
                childIndexes.add(collect((Element) child, index, out));
                tails.add(new StringBuilder());
            } else if (type == Node.TEXT_NODE || type == Node.CDATA_SECTION_NODE) {
                (tails.isEmpty() ? text : tails.get(tails.size() - 1)).append(child.getNodeValue());
            }
        }
        for (int i = 0; i < childIndexes.size(); i++) {
            int childIndex = childIndexes.get(i);
            out.set(childIndex, out.get(childIndex).withTail(characterData(tails.get(i), keepWhitespace)));
        }

        out.set(index, new SvgElement(index, parentIndex, element.getTagName(), localName,
                Collections.unmodifiableMap(attributes), characterData(text, keepWhitespace), "",
                List.copyOf(childIndexes)));
        return index;
    }

    /**
     * Whitespace-only runs are layout indentation except inside text content elements, where
     * they separate words.
     */
    private static String characterData(StringBuilder raw, boolean keepWhitespace) {
        String value = raw.toString();
        return keepWhitespace || !value.isBlank() ? value : "";
    }

    private static DocumentBuilderFactory newFactory() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
        factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);
        return factory;
    }

    private static final class RaisingErrorHandler implements ErrorHandler {

        @Override
        public void warning(SAXParseException exception) {
            log.debug("SVG parser warning at line {}: {}", exception.getLineNumber(), exception.getMessage());
        }

        @Override
        public void error(SAXParseException exception) throws SAXException {
            throw exception;
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXException {
            throw exception;
        }
    }
}
