package com.medimind.intake.parser;

import com.medimind.intake.exception.DocumentParseException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.w3c.dom.Attr;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Renders CCDA/CDA and other XML as an indented outline of humanized tag names.
 */
@Slf4j
@Component
public class XmlNormalizer implements DocumentNormalizer {

    private static final Pattern TAG = Pattern.compile("<[^>]+>");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final String INDENT = "  ";

    @Override
    public String normalize(String content) {
        Element root = parse(content).getDocumentElement();
        List<String> lines = new ArrayList<>();
        render(root, 0, lines);
        return String.join("\n", lines);
    }

    /**
     * Last resort for malformed markup: drops every tag and collapses whitespace.
     */
    public String stripTags(String content) {
        String text = WHITESPACE.matcher(TAG.matcher(content).replaceAll(" ")).replaceAll(" ").strip();
        return text.isEmpty() ? content : text;
    }

    private org.w3c.dom.Document parse(String content) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);

            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new DefaultHandler());
            return builder.parse(new InputSource(new StringReader(content.strip())));
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new DocumentParseException(DocumentFormat.XML, e.getMessage(), e);
        }
    }

    private void render(Element element, int depth, List<String> lines) {
        String indent = INDENT.repeat(depth);
        String tag = Labels.humanize(localName(element));
        String attributes = attributes(element);
        String text = leadingText(element);

        StringBuilder header = new StringBuilder(indent).append(tag);
        if (!attributes.isEmpty()) {
            header.append(" (").append(attributes).append(")");
        }
        header.append(":");
        if (!text.isEmpty()) {
            header.append(" ").append(text);
        }
        lines.add(header.toString());

        String childIndent = INDENT.repeat(depth + 1);
        boolean afterElement = false;
        NodeList children = element.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node child = children.item(i);
            if (child instanceof Element childElement) {
                render(childElement, depth + 1, lines);
                afterElement = true;
            } else if (afterElement && isText(child) && !child.getNodeValue().isBlank()) {
                lines.add(childIndent + child.getNodeValue().strip());
            }
        }
    }

    private static String localName(Element element) {
        String name = element.getLocalName() != null ? element.getLocalName() : element.getTagName();
        int colon = name.indexOf(':');
        return colon >= 0 ? name.substring(colon + 1) : name;
    }

    private static String attributes(Element element) {
        NamedNodeMap attrs = element.getAttributes();
        List<String> rendered = new ArrayList<>();
        for (int i = 0; i < attrs.getLength(); i++) {
            Attr attr = (Attr) attrs.item(i);
            String name = attr.getName();
            if (name.equals("xmlns") || name.startsWith("xmlns:") || attr.getValue().isBlank()) {
                continue;
            }
            rendered.add(name + "=" + attr.getValue());
        }
        return String.join(", ", rendered);
    }

    // text before the first child element; later text belongs to the preceding child
    private static String leadingText(Element element) {
        StringBuilder text = new StringBuilder();
        NodeList children = element.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node child = children.item(i);
            if (child.getNodeType() == Node.ELEMENT_NODE) {
                break;
            }
            if (isText(child)) {
                text.append(child.getNodeValue());
            }
        }
        return WHITESPACE.matcher(text).replaceAll(" ").strip();
    }

    private static boolean isText(Node node) {
        return node.getNodeType() == Node.TEXT_NODE || node.getNodeType() == Node.CDATA_SECTION_NODE;
    }
}
