package it.unimib.datai.runinator.console.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

public final class HttpJson {
    private final ObjectMapper mapper;

    public HttpJson() {
        this(new ObjectMapper());
    }

    public HttpJson(ObjectMapper mapper) {
        this.mapper = mapper.copy().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public String toJson(JsonNode value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize JSON", e);
        }
    }

    /**
     * Parses a response body into a tree; blank or malformed input, and anything after the first value, is rejected.
     */
    public JsonNode readTree(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("Failed to parse JSON: empty body");
        }
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to parse JSON", e);
        }
    }
}
