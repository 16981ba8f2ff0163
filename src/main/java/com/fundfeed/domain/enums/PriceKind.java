package com.fundfeed.domain.enums;

/** Provenance of a quote's price. */
public enum PriceKind {

    /** Intraday estimate, provisional until the NAV settles. */
    ESTIMATE,

    /** Authoritative end-of-day NAV that superseded the estimate. */
    SETTLED,

    /** Most recent published NAV read from the history series. */
    LAST_NAV
}
