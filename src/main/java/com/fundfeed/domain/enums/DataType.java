package com.fundfeed.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Logical data types served by the pipeline. The key doubles as the cache-key prefix and
 * as the property key for per-type provider selection.
 */
@Getter
@RequiredArgsConstructor
public enum DataType {
    FUND_REALTIME("fund_realtime"),
    FUND_HISTORY("fund_history"),
    SECTOR_FLOW("sector_flow");

    private final String key;

    /** Resolves both {@code fund_realtime} and {@code fund-realtime} spellings. */
    public static DataType fromKey(String key) {
        String normalized = key.trim().toLowerCase().replace('-', '_');
        for (DataType type : values()) {
            if (type.key.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown data type: " + key);
    }
}
