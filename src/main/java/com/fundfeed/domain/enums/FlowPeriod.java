package com.fundfeed.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Aggregation window of a fund-flow ranking. */
@Getter
@RequiredArgsConstructor
public enum FlowPeriod {
    TODAY("今日", 1),
    FIVE_DAY("5日", 5),
    TEN_DAY("10日", 10);

    private final String label;
    private final int tradingDays;
}
