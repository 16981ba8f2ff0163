package com.fundfeed.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * Authoritative end-of-day NAV for a date, together with the NAV it changed from.
 * {@code previousNav} and {@code changePct} are null when the series has no earlier point.
 */
@Value
@Builder
public class SettledNav {

    LocalDate navDate;
    BigDecimal nav;
    BigDecimal previousNav;
    BigDecimal changePct;
}
