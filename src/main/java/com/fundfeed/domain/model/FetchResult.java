package com.fundfeed.domain.model;

import com.fundfeed.domain.enums.FetchOutcome;
import java.time.Instant;
import lombok.Getter;

/**
 * Outcome of one pipeline call.
 *
 * <p>{@code value} is null only when {@code outcome} is {@link FetchOutcome#NO_DATA}. For
 * cache-served results {@code source} is the name of the source that originally produced the
 * value and {@code fetchedAt} is when it was stored.
 */
@Getter
public final class FetchResult<T> {

    private final T value;
    private final String source;
    private final Instant fetchedAt;
    private final boolean stale;
    private final FetchOutcome outcome;

    private FetchResult(T value, String source, Instant fetchedAt, boolean stale, FetchOutcome outcome) {
        this.value = value;
        this.source = source;
        this.fetchedAt = fetchedAt;
        this.stale = stale;
        this.outcome = outcome;
    }

    public static <T> FetchResult<T> fresh(T value, String source, Instant fetchedAt) {
        return new FetchResult<>(value, source, fetchedAt, false, FetchOutcome.FRESH_CACHE);
    }

    public static <T> FetchResult<T> fromSource(T value, String source, Instant fetchedAt) {
        return new FetchResult<>(value, source, fetchedAt, false, FetchOutcome.SOURCE);
    }

    public static <T> FetchResult<T> stale(T value, String source, Instant fetchedAt) {
        return new FetchResult<>(value, source, fetchedAt, true, FetchOutcome.STALE_CACHE);
    }

    public static <T> FetchResult<T> noData() {
        return new FetchResult<>(null, null, null, false, FetchOutcome.NO_DATA);
    }

    /** Same provenance, different value; used to post-process a value after the pipeline. */
    public FetchResult<T> withValue(T newValue) {
        if (value == null) {
            throw new IllegalStateException("Cannot replace the value of a no-data result");
        }
        return new FetchResult<>(newValue, source, fetchedAt, stale, outcome);
    }

    public boolean isPresent() {
        return value != null;
    }

    @Override
    public String toString() {
        return "FetchResult{outcome=" + outcome + ", source=" + source + ", stale=" + stale + ", fetchedAt="
                + fetchedAt + "}";
    }
}
