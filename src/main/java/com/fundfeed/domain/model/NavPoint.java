package com.fundfeed.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Value;

/** One element of a NAV history series. Series are ordered ascending by date. */
@Value
public class NavPoint {

    LocalDate date;
    BigDecimal close;

    @JsonCreator
    public NavPoint(@JsonProperty("date") LocalDate date, @JsonProperty("close") BigDecimal close) {
        this.date = date;
        this.close = close;
    }
}
