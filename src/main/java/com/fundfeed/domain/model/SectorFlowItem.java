package com.fundfeed.domain.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * One row of a sector fund-flow ranking. Amounts are in yuan; any amount or percentage the
 * vendor did not supply is null.
 */
@Value
@Builder(toBuilder = true)
@JsonDeserialize(builder = SectorFlowItem.SectorFlowItemBuilder.class)
public class SectorFlowItem {

    public static final String UNIT_CNY = "CNY";

    /** 1-based rank by main net inflow, descending. */
    int rank;

    /** Vendor board code, when the vendor exposes one. */
    String code;

    String name;

    BigDecimal changePct;

    BigDecimal mainNetInflow;

    BigDecimal mainInflow;

    BigDecimal mainOutflow;

    BigDecimal mainNetInflowPct;

    @Builder.Default
    String unit = UNIT_CNY;

    @JsonPOJOBuilder(withPrefix = "")
    public static class SectorFlowItemBuilder {}
}
