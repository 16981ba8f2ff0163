package com.fundfeed.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Sector board families used by fund-flow rankings. The vendor labels are what the
 * upstream sites call the board families.
 */
@Getter
@RequiredArgsConstructor
public enum SectorKind {
    INDUSTRY("行业资金流", "行业"),
    CONCEPT("概念资金流", "概念"),
    REGION("地域资金流", "地域");

    private final String label;
    private final String shortLabel;
}
