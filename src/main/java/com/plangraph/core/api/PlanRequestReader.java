package com.plangraph.core.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.Map;

/**
 * Reads operation options from JSON text or a loose map and checks their shape.
 * <p>
 * Accepted input is a single object whose properties are all known to the
 * target request type and all JSON booleans. Absent properties take the
 * request's default. Anything else is an {@link InvalidPlanRequestException}.
 */
@Component
public class PlanRequestReader {

    private final ObjectMapper mapper = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
            .disable(MapperFeature.ALLOW_COERCION_OF_SCALARS)
            .build();

    public <T> T read(String json, Class<T> requestType) {
        if (json == null || json.isBlank()) {
            return readTree(mapper.createObjectNode(), requestType);
        }
        JsonNode tree;
        try {
            tree = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new InvalidPlanRequestException(
                    "Options for " + requestType.getSimpleName() + " are not valid JSON: " + e.getOriginalMessage(), e);
        }
        return readTree(tree, requestType);
    }

    public <T> T read(Map<String, ?> options, Class<T> requestType) {
        if (options == null) {
            throw new InvalidPlanRequestException("Options for " + requestType.getSimpleName() + " must not be null");
        }
        JsonNode tree;
        try {
            tree = mapper.valueToTree(options);
        } catch (IllegalArgumentException e) {
            throw new InvalidPlanRequestException(
                    "Options for " + requestType.getSimpleName() + " cannot be read: " + e.getMessage(), e);
        }
        return readTree(tree, requestType);
    }

    private <T> T readTree(JsonNode tree, Class<T> requestType) {
        String name = requestType.getSimpleName();
        if (tree == null || !tree.isObject()) {
            throw new InvalidPlanRequestException("Options for " + name + " must be an object");
        }
        for (Iterator<Map.Entry<String, JsonNode>> it = tree.fields(); it.hasNext(); ) {
            var field = it.next();
            if (!field.getValue().isBoolean()) {
                throw new InvalidPlanRequestException(
                        "Option '" + field.getKey() + "' of " + name + " must be a boolean, got "
                                + field.getValue().getNodeType().name().toLowerCase());
            }
        }
        try {
            return mapper.treeToValue(tree, requestType);
        } catch (JsonProcessingException e) {
            throw new InvalidPlanRequestException("Invalid options for " + name + ": " + e.getOriginalMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new InvalidPlanRequestException("Invalid options for " + name + ": " + e.getMessage(), e);
        }
    }
}
