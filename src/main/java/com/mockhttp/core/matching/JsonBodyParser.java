package com.mockhttp.core.matching;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utility class for parsing JSON request bodies.
 */
public final class JsonBodyParser {

    private static final Logger logger = LoggerFactory.getLogger(JsonBodyParser.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private JsonBodyParser() {
        // utility class
    }

    /**
     * Parses a JSON string into a JsonNode.
     *
     * @param json The JSON string to parse
     * @return The parsed JsonNode, or null if the input is blank or not valid JSON
     */
    public static JsonNode parseJson(String json) {
        if (json == null || json.trim().isEmpty()) {
            return null;
        }

        try {
            return objectMapper.readTree(json);
        } catch (Exception e) {
            logger.debug("Failed to parse JSON: {}", e.getMessage());
            return null;
        }
    }
}
