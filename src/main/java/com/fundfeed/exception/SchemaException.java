package com.fundfeed.exception;

import com.fundfeed.domain.enums.FailureKind;

/**
 * The vendor answered, but the payload does not have the expected shape (wrapper missing,
 * required column not found after alias search, unparsable body). Never retried.
 */
public class SchemaException extends SourceException {

    public SchemaException(String message) {
        super(FailureKind.SCHEMA, message);
    }

    public SchemaException(String message, Throwable cause) {
        super(FailureKind.SCHEMA, message, cause);
    }
}
