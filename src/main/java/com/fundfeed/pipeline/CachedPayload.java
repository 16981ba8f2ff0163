package com.fundfeed.pipeline;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fundfeed.mapper.JsonHelper;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Cache envelope: the normalized value plus the source that produced it and when, so a
 * cache-served result reports the same provenance as the original fetch.
 */
final class CachedPayload<T> {

    private final String source;
    private final Instant fetchedAt;
    private final T value;

    private CachedPayload(String source, Instant fetchedAt, T value) {
        this.source = source;
        this.fetchedAt = fetchedAt;
        this.value = value;
    }

    static String encode(String source, Instant fetchedAt, Object value) {
        ObjectNode node = JsonHelper.createObjectNode();
        node.put("source", source);
        node.put("fetchedAt", fetchedAt.toString());
        node.set("value", JsonHelper.valueToTree(value));
        return JsonHelper.toJson(node);
    }

    /**
     * @throws IllegalArgumentException if the text is not an envelope or the value does not
     *     bind to {@code type}
     */
    static <T> CachedPayload<T> decode(String text, TypeReference<T> type) {
        JsonNode node = JsonHelper.readTree(text);
        JsonNode value = node.get("value");
        if (value == null || value.isNull() || !node.hasNonNull("source") || !node.hasNonNull("fetchedAt")) {
            throw new IllegalArgumentException("Not a cache envelope");
        }
        try {
            Instant fetchedAt = Instant.parse(node.get("fetchedAt").asText());
            return new CachedPayload<>(node.get("source").asText(), fetchedAt, JsonHelper.treeToValue(value, type));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Bad fetchedAt in cache envelope", e);
        }
    }

    String getSource() {
        return source;
    }

    Instant getFetchedAt() {
        return fetchedAt;
    }

    T getValue() {
        return value;
    }
}
