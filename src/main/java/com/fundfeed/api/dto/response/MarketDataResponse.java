package com.fundfeed.api.dto.response;

import com.fundfeed.domain.enums.FetchOutcome;
import com.fundfeed.domain.model.FetchResult;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/**
 * Market data answer with its provenance.
 *
 * <p>When nothing could be obtained {@code available} is false and {@code data} is null; this
 * is a normal 200 response, not an error.
 */
@Getter
@Builder
public class MarketDataResponse<T> {

    private final boolean available;

    /** True when every source failed and an expired cached value was served. */
    private final boolean stale;

    private final FetchOutcome outcome;

    /** Source that produced the value, also for cache-served values. */
    private final String source;

    private final Instant fetchedAt;

    private final T data;

    public static <T> MarketDataResponse<T> from(FetchResult<T> result) {
        return MarketDataResponse.<T>builder()
                .available(result.isPresent())
                .stale(result.isStale())
                .outcome(result.getOutcome())
                .source(result.getSource())
                .fetchedAt(result.getFetchedAt())
                .data(result.getValue())
                .build();
    }
}
