package com.tenex.sync.core.parse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Schema-checked access to JSON-bearing record content.
 *
 * <p>Decoding never throws. Content that is not a JSON object decodes to empty and callers fall
 * back to the raw text; a field of the wrong JSON type reads as absent.</p>
 */
public final class JsonContent {

    private static final Logger log = LoggerFactory.getLogger(JsonContent.class);

    private static final ObjectMapper MAPPER = newMapper();

    private JsonContent() {}

    /**
     * Mapper with the settings every JSON path of the sync core shares: {@code java.time} support,
     * ISO-8601 instants, and tolerance of unknown properties. The Spring {@code ObjectMapper} bean
     * is built here too.
     */
    public static ObjectMapper newMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    /**
     * Parses {@code content} as a JSON object.
     */
    public static Optional<JsonNode> object(String content) {
        if (content == null || content.isBlank()) {
            return Optional.empty();
        }
        String trimmed = content.trim();
        if (!trimmed.startsWith("{")) {
            return Optional.empty();
        }
        try {
            JsonNode node = MAPPER.readTree(trimmed);
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            log.debug("Content is not valid JSON, using raw text: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    public static Optional<String> text(JsonNode object, String field) {
        JsonNode v = object.get(field);
        return v != null && v.isTextual() ? Optional.of(v.asText()) : Optional.empty();
    }

    public static Optional<Double> decimal(JsonNode object, String field) {
        JsonNode v = object.get(field);
        return v != null && v.isNumber() ? Optional.of(v.doubleValue()) : Optional.empty();
    }

    public static Optional<Integer> integer(JsonNode object, String field) {
        JsonNode v = object.get(field);
        return v != null && v.isIntegralNumber() && v.canConvertToInt()
                ? Optional.of(v.intValue())
                : Optional.empty();
    }

    /**
     * Serializes a flat map for outgoing content. Field order follows the map's iteration order.
     */
    public static String write(Map<String, ?> fields) {
        try {
            return MAPPER.writeValueAsString(fields);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize content to JSON", e);
        }
    }
}
