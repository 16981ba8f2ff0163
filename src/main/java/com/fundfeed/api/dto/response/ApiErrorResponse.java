package com.fundfeed.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fundfeed.exception.BaseException;
import com.fundfeed.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Error envelope for rejected requests. Upstream vendor failures never show up here: they
 * are absorbed by the fetch pipeline and reported as {@code available=false}.
 */
@Getter
public class ApiErrorResponse {

    private final boolean success = false;
    private final ErrorDetail error;

    private ApiErrorResponse(ErrorDetail error) {
        this.error = error;
    }

    public static ApiErrorResponse of(BaseException ex, String path, Instant timestamp) {
        return of(ex.getErrorCode(), ex.getMessage(), ex.getDetails(), path, timestamp);
    }

    public static ApiErrorResponse of(
            ErrorCode errorCode, String message, Map<String, Object> details, String path, Instant timestamp) {
        return new ApiErrorResponse(ErrorDetail.builder()
                .code(errorCode.getCode())
                .message(message)
                .details(details)
                .path(path)
                .timestamp(timestamp)
                .build());
    }

    @Getter
    @Builder
    public static class ErrorDetail {
        private final String code;
        private final String message;

        /** Offending request values keyed by parameter name; omitted when there are none. */
        @JsonInclude(JsonInclude.Include.NON_EMPTY)
        private final Map<String, Object> details;

        private final String path;
        private final Instant timestamp;
    }
}
