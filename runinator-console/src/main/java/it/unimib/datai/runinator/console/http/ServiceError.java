package it.unimib.datai.runinator.console.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Best-effort human readable message for a failed exchange.
 */
final class ServiceError {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ServiceError() {}

    /**
     * Picks the body's JSON {@code message}, then the trimmed raw body, then {@code transportDescription}.
     */
    static String extractMessage(String body, String transportDescription) {
        if (body != null && !body.isBlank()) {
            String fromJson = jsonMessage(body);
            if (fromJson != null && !fromJson.isEmpty()) {
                return fromJson;
            }
            return body.trim();
        }
        return transportDescription;
    }

    private static String jsonMessage(String body) {
        try {
            JsonNode root = MAPPER.readTree(body);
            if (root == null || !root.isObject()) {
                return null;
            }
            JsonNode message = root.get("message");
            return (message == null || !message.isTextual()) ? null : message.asText();
        } catch (Exception notJson) {
            return null;
        }
    }
}
