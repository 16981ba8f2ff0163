package com.fundfeed.provider;

import com.fundfeed.domain.enums.DataType;
import com.fundfeed.domain.model.FetchRequest;

/**
 * One upstream vendor endpoint serving one data type.
 *
 * <p>{@link #fetch} returns a normalized value or throws a
 * {@link com.fundfeed.exception.SourceException}; it never returns a partially parsed value.
 * Adapters hold no mutable state of their own, so one instance serves concurrent callers.
 *
 * @param <T> normalized value type
 */
public interface ProviderAdapter<T> {

    /** Registry name, e.g. {@code eastmoney_fundgz}. */
    String sourceName();

    DataType dataType();

    int defaultPriority();

    /** False when a required credential is missing; such adapters are never registered. */
    default boolean isConfigured() {
        return true;
    }

    T fetch(FetchRequest request);
}
