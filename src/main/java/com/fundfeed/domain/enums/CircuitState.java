package com.fundfeed.domain.enums;

/**
 * Circuit breaker state of one registered source.
 *
 * <p>HALF_OPEN is never stored: it is derived when the failure threshold has been reached
 * but the cooldown has elapsed, and the next attempt's outcome decides between CLOSED and
 * OPEN.
 */
public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
