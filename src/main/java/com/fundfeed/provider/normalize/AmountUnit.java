package com.fundfeed.provider.normalize;

import java.math.BigDecimal;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Unit a vendor column is expressed in when its cells carry no suffix. */
@Getter
@RequiredArgsConstructor
public enum AmountUnit {
    YUAN(BigDecimal.ONE),
    WAN(new BigDecimal("10000")),
    YI(new BigDecimal("100000000"));

    private final BigDecimal multiplier;
}
