package com.fundfeed.exception;

import com.fundfeed.domain.enums.FailureKind;
import lombok.Getter;

/**
 * Base class for failures raised by a provider adapter while talking to an upstream vendor.
 *
 * <p>These never cross the FetchPipeline boundary: the pipeline catches them, records the
 * failure against the source's circuit breaker and moves on to the next source. The
 * {@link FailureKind} decides whether the adapter's retry policy tries again.
 */
@Getter
public abstract class SourceException extends BaseException {

    private final FailureKind failureKind;

    protected SourceException(FailureKind failureKind, String message) {
        super(ErrorCode.UPSTREAM_ERROR, message);
        this.failureKind = failureKind;
    }

    protected SourceException(FailureKind failureKind, String message, Throwable cause) {
        super(ErrorCode.UPSTREAM_ERROR, message, cause);
        this.failureKind = failureKind;
    }
}
