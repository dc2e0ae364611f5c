package com.opstranslate.core.parser.base;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.opstranslate.core.parser.StructuralParseException;

/**
 * Abstract base class for parsers that read XML documents using Jackson.
 *
 * <p>Documents are read into a {@link JsonNode} tree. With Jackson's XML tree model,
 * attributes and child elements both become object properties, repeated elements
 * become arrays and the text of an element that also has attributes is stored
 * under the empty key.
 *
 * @see AbstractSourceParser
 */
public abstract class AbstractJacksonParser extends AbstractSourceParser {

    /**
     * XML mapper for parsing documents.
     * Thread-safe and reusable across parse operations.
     */
    protected final XmlMapper xmlMapper;

    protected AbstractJacksonParser() {
        super();
        this.xmlMapper = new XmlMapper();
    }

    // ==================== XML Parsing ====================

    /**
     * Parses XML content into a JsonNode tree.
     *
     * @param sourceName document name used in the error message
     * @param xmlContent XML content
     * @return root node
     * @throws StructuralParseException if the content is not well-formed XML
     */
    protected JsonNode parseXmlContent(String sourceName, String xmlContent) throws StructuralParseException {
        if (xmlContent == null || xmlContent.isBlank()) {
            throw new StructuralParseException(sourceName, "document is empty");
        }
        try {
            JsonNode root = xmlMapper.readTree(xmlContent);
            if (root == null || root.isMissingNode()) {
                throw new StructuralParseException(sourceName, "document has no root element");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new StructuralParseException(sourceName, "invalid XML: " + e.getOriginalMessage(), e);
        }
    }

    // ==================== JsonNode Navigation Utilities ====================

    /**
     * Extracts an attribute value from a node.
     *
     * @param node node to extract from
     * @param attributeName attribute name
     * @return attribute value, or null if absent
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
     * Extracts the text of a child element.
     *
     * <p>Handles both plain text children and children that carry attributes, whose
     * text sits under the empty key.
     *
     * @param node parent node
     * @param childName child element name
     * @return child text, or null if absent
     */
    protected String extractText(JsonNode node, String childName) {
        if (node == null) {
            return null;
        }
        JsonNode childNode = node.get(childName);
        if (childNode == null) {
            return null;
        }
        if (childNode.isValueNode()) {
            return childNode.asText();
        }
        JsonNode text = childNode.get("");
        return text != null && text.isValueNode() ? text.asText() : null;
    }

    /**
     * Normalizes a node to always be an array.
     *
     * <p>Useful for handling XML elements that can appear once or multiple times.
     *
     * @param node node to normalize
     * @return array node
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
