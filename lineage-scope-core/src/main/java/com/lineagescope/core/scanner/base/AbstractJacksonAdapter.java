package com.lineagescope.core.scanner.base;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Abstract base class for adapters that parse XML or JSON definitions using Jackson.
 *
 * <p>For XML, elements become object fields and attributes become fields of the same name.
 * Repeated elements become arrays; {@link #normalizeToArray(JsonNode)} hides the
 * difference between one and many.
 *
 * @see AbstractFormatAdapter
 */
public abstract class AbstractJacksonAdapter extends AbstractFormatAdapter {

    /**
     * XML mapper for parsing XML files.
     * Thread-safe and reusable across parse operations.
     */
    protected final XmlMapper xmlMapper;

    /**
     * JSON mapper for pipeline and notebook files.
     */
    protected final ObjectMapper objectMapper;

    protected AbstractJacksonAdapter() {
        super();
        this.xmlMapper = new XmlMapper();
        this.objectMapper = new ObjectMapper();
    }

    // ==================== XML Parsing ====================

    /**
     * Parses an XML file into a JsonNode tree.
     *
     * @param file path to XML file
     * @return root JsonNode of parsed XML
     * @throws IOException if file cannot be read or parsed
     */
    protected JsonNode parseXml(Path file) throws IOException {
        return xmlMapper.readTree(readFileContent(file));
    }

    // ==================== JSON Parsing ====================

    /**
     * Parses a JSON file into a JsonNode tree.
     *
     * @param file path to JSON file
     * @return root JsonNode of parsed JSON
     * @throws IOException if file cannot be read or parsed
     */
    protected JsonNode parseJson(Path file) throws IOException {
        return objectMapper.readTree(readFileContent(file));
    }

    // ==================== JsonNode Navigation Utilities ====================

    /**
     * Extracts an attribute value from a JsonNode.
     *
     * @param node JsonNode to extract from
     * @param attributeName attribute name
     * @return attribute value as string, or null if not found
     */
    protected String extractAttribute(JsonNode node, String attributeName) {
        if (node == null) {
            return null;
        }
        JsonNode attrNode = node.get(attributeName);
        if (attrNode != null && attrNode.isValueNode()) {
            return attrNode.asText();
        }
        return null;
    }

    /**
     * Extracts the text content of a child element.
     *
     * <p>Elements that carry attributes keep their text under the empty field name.
     *
     * @param node parent JsonNode
     * @param childName child element name
     * @return text content of child, or null if not found
     */
    protected String extractText(JsonNode node, String childName) {
        if (node == null) {
            return null;
        }
        return textOf(node.get(childName));
    }

    /**
     * Returns the text content of an element node.
     *
     * @param node element node, may be null
     * @return trimmed text, or null if the element has none
     */
    protected String textOf(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isValueNode()) {
            return node.asText().trim();
        }
        JsonNode text = node.get("");
        return text != null && text.isValueNode() ? text.asText().trim() : null;
    }

    /**
     * Collects the text of every occurrence of a repeated child element.
     *
     * @param node parent JsonNode
     * @param childName child element name
     * @return texts in document order
     */
    protected List<String> extractTexts(JsonNode node, String childName) {
        List<String> texts = new ArrayList<>();
        if (node == null) {
            return texts;
        }
        for (JsonNode child : normalizeToArray(node.get(childName))) {
            String text = textOf(child);
            if (text != null && !text.isEmpty()) {
                texts.add(text);
            }
        }
        return texts;
    }

    /**
     * Normalizes a JsonNode to always be an array.
     *
     * @param node JsonNode to normalize
     * @return array JsonNode, empty for null
     */
    protected JsonNode normalizeToArray(JsonNode node) {
        if (node == null) {
            return xmlMapper.createArrayNode();
        }
        if (node.isArray()) {
            return node;
        }
        return xmlMapper.createArrayNode().add(node);
    }
}
