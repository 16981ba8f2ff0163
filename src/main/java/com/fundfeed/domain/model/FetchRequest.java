package com.fundfeed.domain.model;

import com.fundfeed.domain.enums.DataType;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Immutable description of what a caller wants: a logical data type plus its parameters.
 *
 * <p>Parameters are kept sorted by key so that two requests with the same parameters in a
 * different insertion order produce the same cache key.
 */
public final class FetchRequest {

    private final DataType dataType;
    private final Map<String, String> params;

    private FetchRequest(DataType dataType, Map<String, String> params) {
        this.dataType = Objects.requireNonNull(dataType, "dataType");
        this.params = Collections.unmodifiableSortedMap(new TreeMap<>(params));
    }

    public static FetchRequest of(DataType dataType, Map<String, String> params) {
        return new FetchRequest(dataType, params);
    }

    public static FetchRequest of(DataType dataType, String key, String value) {
        return new FetchRequest(dataType, Map.of(key, value));
    }

    public DataType getDataType() {
        return dataType;
    }

    public Map<String, String> getParams() {
        return params;
    }

    /** Returns the parameter value, failing loudly when an adapter reads a parameter the caller never set. */
    public String require(String key) {
        String value = params.get(key);
        if (value == null) {
            throw new IllegalArgumentException("Missing request parameter '" + key + "' for " + dataType.getKey());
        }
        return value;
    }

    public String get(String key, String defaultValue) {
        return params.getOrDefault(key, defaultValue);
    }

    /** Deterministic cache key, e.g. {@code fund_realtime:code=008888}. */
    public String cacheKey() {
        if (params.isEmpty()) {
            return dataType.getKey();
        }
        return dataType.getKey() + ":"
                + params.entrySet().stream()
                        .map(e -> e.getKey() + "=" + e.getValue())
                        .collect(Collectors.joining(":"));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FetchRequest)) {
            return false;
        }
        FetchRequest that = (FetchRequest) o;
        return dataType == that.dataType && params.equals(that.params);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dataType, params);
    }

    @Override
    public String toString() {
        return cacheKey();
    }
}
