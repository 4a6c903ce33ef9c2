package com.gomflow.collab.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.gomflow.collab.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSONB column helpers.
 */
final class JdbcJson {
    private static final Logger log = LoggerFactory.getLogger(JdbcJson.class);

    /**
     * Parse a JSONB column value. Null or unparseable text reads as null.
     */
    static JsonNode read(String raw) {
        if (raw == null || raw.isEmpty()) {
            return null;
        }
        try {
            return Json.MAPPER.readTree(raw);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring malformed JSONB value: {}", e.getOriginalMessage());
            return null;
        }
    }

    /**
     * Render a value for a {@code ?::jsonb} parameter. Null stays SQL NULL.
     */
    static String write(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        return node.toString();
    }

    private JdbcJson() {}
}
