package com.fundfeed.domain.enums;

/** How a pipeline call was answered. */
public enum FetchOutcome {

    /** Unexpired cache entry that passed the validator; no network call. */
    FRESH_CACHE,

    /** First validator-passing answer from a live source. */
    SOURCE,

    /** Every live source failed; an expired cache entry was served. */
    STALE_CACHE,

    /** Every live source failed and nothing was ever cached. */
    NO_DATA
}
