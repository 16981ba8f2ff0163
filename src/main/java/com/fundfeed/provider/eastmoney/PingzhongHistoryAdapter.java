package com.fundfeed.provider.eastmoney;

import com.fasterxml.jackson.databind.JsonNode;
import com.fundfeed.calendar.TradingCalendarService;
import com.fundfeed.domain.enums.DataType;
import com.fundfeed.domain.model.FetchRequest;
import com.fundfeed.domain.model.NavPoint;
import com.fundfeed.exception.SchemaException;
import com.fundfeed.mapper.JsonHelper;
import com.fundfeed.provider.AbstractProviderAdapter;
import com.fundfeed.provider.RetryPolicy;
import com.fundfeed.provider.VendorHttpClient;
import com.fundfeed.provider.VendorUris;
import com.fundfeed.provider.normalize.DecimalParser;
import com.fundfeed.provider.normalize.JsonpParser;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * NAV history from the pingzhongdata script, which assigns the full series to
 * {@code var Data_netWorthTrend = [{"x":1704412800000,"y":1.2345,...},...];} with
 * {@code x} the NAV date as epoch milliseconds at exchange-local midnight.
 */
@Component
public class PingzhongHistoryAdapter extends AbstractProviderAdapter<String, List<NavPoint>> {

    public static final String SOURCE_NAME = "eastmoney_pingzhong";

    static final String URL = "https://fund.eastmoney.com/pingzhongdata/{code}.js";
    static final String REFERER = "https://fund.eastmoney.com/";
    static final String SERIES_VARIABLE = "Data_netWorthTrend";

    private final TradingCalendarService tradingCalendarService;

    public PingzhongHistoryAdapter(
            VendorHttpClient vendorHttpClient, RetryPolicy retryPolicy, TradingCalendarService tradingCalendarService) {
        super(vendorHttpClient, retryPolicy);
        this.tradingCalendarService = tradingCalendarService;
    }

    @Override
    public String sourceName() {
        return SOURCE_NAME;
    }

    @Override
    public DataType dataType() {
        return DataType.FUND_HISTORY;
    }

    @Override
    public int defaultPriority() {
        return 80;
    }

    @Override
    protected String fetchRaw(FetchRequest request) {
        return vendorHttpClient.get(
                VendorUris.build(
                        URL, Map.of("code", request.require("code")), Map.of("v", System.currentTimeMillis())),
                REFERER);
    }

    @Override
    protected List<NavPoint> normalize(String raw, FetchRequest request) {
        JsonNode series;
        try {
            series = JsonHelper.readTree(JsonpParser.extractVariable(raw, SERIES_VARIABLE));
        } catch (IllegalArgumentException e) {
            throw new SchemaException(SERIES_VARIABLE + " is not a JSON literal: " + e.getMessage(), e);
        }
        if (!series.isArray()) {
            throw new SchemaException(SERIES_VARIABLE + " is not an array");
        }

        ZoneId zone = tradingCalendarService.zone();
        Map<LocalDate, NavPoint> byDate = new LinkedHashMap<>();
        for (JsonNode point : series) {
            JsonNode x = point.get("x");
            BigDecimal nav = DecimalParser.parsePositive(point.has("y") ? point.get("y").asText() : null);
            if (x == null || !x.canConvertToLong() || nav == null) {
                continue;
            }
            LocalDate date = Instant.ofEpochMilli(x.asLong()).atZone(zone).toLocalDate();
            byDate.put(date, new NavPoint(date, nav));
        }
        List<NavPoint> points = new ArrayList<>(byDate.values());
        points.sort(Comparator.comparing(NavPoint::getDate));
        return points;
    }
}
