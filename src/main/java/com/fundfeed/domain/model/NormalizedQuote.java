package com.fundfeed.domain.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.fundfeed.domain.enums.PriceKind;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * Latest known price of a fund, after normalization.
 *
 * <p>{@code price} is always positive. {@code changePct} is null when the vendor did not
 * provide a usable percentage; it is never defaulted to zero. For an intraday estimate
 * {@code asOf} is the vendor's estimate timestamp and {@code navDate} the last published NAV
 * date; for a settled or last-NAV quote both refer to the NAV date.
 */
@Value
@Builder(toBuilder = true)
@JsonDeserialize(builder = NormalizedQuote.NormalizedQuoteBuilder.class)
public class NormalizedQuote {

    /** Six-digit fund code. */
    String code;

    String name;

    BigDecimal price;

    /** NAV the change percentage is measured against. Null when unknown. */
    BigDecimal previousClose;

    BigDecimal changePct;

    LocalDateTime asOf;

    LocalDate navDate;

    PriceKind priceKind;

    /** Name of the source that produced this quote. */
    String source;

    @JsonPOJOBuilder(withPrefix = "")
    public static class NormalizedQuoteBuilder {}
}
