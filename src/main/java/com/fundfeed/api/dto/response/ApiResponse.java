package com.fundfeed.api.dto.response;

import java.time.Instant;
import lombok.Getter;

/**
 * Success envelope added around every controller body by ApiResponseAdvice.
 * {@code timestamp} is when the answer was served, not when the data was fetched; the latter
 * is {@code data.fetchedAt} for market data.
 */
@Getter
public class ApiResponse<T> {

    private final boolean success = true;
    private final T data;
    private final Instant timestamp;

    private ApiResponse(T data, Instant timestamp) {
        this.data = data;
        this.timestamp = timestamp;
    }

    public static <T> ApiResponse<T> of(T data, Instant servedAt) {
        return new ApiResponse<>(data, servedAt);
    }
}
