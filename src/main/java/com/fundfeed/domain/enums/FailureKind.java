package com.fundfeed.domain.enums;

/**
 * Why a single source attempt failed.
 *
 * <p>Only NETWORK failures are retried inside an adapter. VALIDATION is assigned by the
 * pipeline when an adapter returned without throwing but the value failed the request
 * type's validator.
 */
public enum FailureKind {

    /** Timeout, connection reset, proxy failure, HTTP 429/5xx. */
    NETWORK,

    /** Expected wrapper, field or column not found; unparsable payload. */
    SCHEMA,

    /** Vendor explicitly refused the request (4xx, API error code). */
    UPSTREAM_REJECTED,

    /** Syntactically valid answer that is semantically unusable (empty table, zero price). */
    VALIDATION,

    /** Anything else thrown by adapter code. */
    UNEXPECTED
}
