package com.fundfeed.exception;

import com.fundfeed.domain.enums.FailureKind;

/** Non-retryable HTTP rejection (4xx other than 429) or a vendor-level error code. */
public class UpstreamRejectedException extends SourceException {

    public UpstreamRejectedException(String message) {
        super(FailureKind.UPSTREAM_REJECTED, message);
    }
}
