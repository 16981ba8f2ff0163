package com.fundfeed.exception;

import com.fundfeed.domain.enums.FailureKind;

/** Timeout, connection reset, proxy failure, HTTP 429 or 5xx. Retried inside the adapter. */
public class TransientNetworkException extends SourceException {

    public TransientNetworkException(String message) {
        super(FailureKind.NETWORK, message);
    }

    public TransientNetworkException(String message, Throwable cause) {
        super(FailureKind.NETWORK, message, cause);
    }
}
