package de.bsommerfeld.tachobridge.api;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Lenient field access for backend responses. Ids arrive as strings from
 * one endpoint and as numbers from another, so every scalar is read as text.
 */
public final class JsonFields {

    private JsonFields() {
    }

    /**
     * Returns the scalar value of {@code field} as text, or {@code null} when
     * the node is absent, {@code null}, not a scalar, or blank.
     */
    public static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.path(field);
        if (!value.isValueNode() || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    /**
     * Unwraps the common {@code {"data": ...}} envelope; returns the node
     * itself when there is none.
     */
    public static JsonNode unwrap(JsonNode node) {
        if (node != null && node.isObject() && node.has("data")) {
            return node.get("data");
        }
        return node;
    }
}
