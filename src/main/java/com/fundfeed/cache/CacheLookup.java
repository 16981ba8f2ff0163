package com.fundfeed.cache;

import lombok.Value;

/** Result of a stale-tolerant cache read. */
@Value
public class CacheLookup {

    String value;

    /** True when the entry's expiry has passed. */
    boolean stale;
}
