package com.fundfeed.provider.eastmoney;

import com.fasterxml.jackson.databind.JsonNode;
import com.fundfeed.domain.enums.DataType;
import com.fundfeed.domain.enums.PriceKind;
import com.fundfeed.domain.model.FetchRequest;
import com.fundfeed.domain.model.NormalizedQuote;
import com.fundfeed.exception.SchemaException;
import com.fundfeed.mapper.JsonHelper;
import com.fundfeed.provider.AbstractProviderAdapter;
import com.fundfeed.provider.RetryPolicy;
import com.fundfeed.provider.VendorHttpClient;
import com.fundfeed.provider.VendorUris;
import com.fundfeed.provider.normalize.DecimalParser;
import com.fundfeed.provider.normalize.JsonpParser;
import com.fundfeed.provider.normalize.PercentParser;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Intraday NAV estimate from the fundgz JSONP endpoint.
 *
 * <p>Payload: {@code jsonpgz({"fundcode":"008888","name":"...","jzrq":"2024-01-05",
 * "dwjz":"1.2345","gsz":"1.2400","gszzl":"0.45","gztime":"2024-01-08 14:30"});}
 * where {@code dwjz} is the last published NAV dated {@code jzrq} and {@code gsz} the
 * current estimate. Funds the vendor does not estimate answer {@code jsonpgz();}.
 *
 * <p>The quote keeps {@code jzrq} as its navDate so the settlement check can tell whether
 * {@code dwjz} is already the newest NAV.
 */
@Component
public class FundgzEstimateAdapter extends AbstractProviderAdapter<String, NormalizedQuote> {

    public static final String SOURCE_NAME = "eastmoney_fundgz";

    static final String URL = "https://fundgz.1234567.com.cn/js/{code}.js";
    static final String REFERER = "https://fund.eastmoney.com/";

    private static final DateTimeFormatter GZTIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    public FundgzEstimateAdapter(VendorHttpClient vendorHttpClient, RetryPolicy retryPolicy) {
        super(vendorHttpClient, retryPolicy);
    }

    @Override
    public String sourceName() {
        return SOURCE_NAME;
    }

    @Override
    public DataType dataType() {
        return DataType.FUND_REALTIME;
    }

    @Override
    public int defaultPriority() {
        return 100;
    }

    @Override
    protected String fetchRaw(FetchRequest request) {
        String code = request.require("code");
        return vendorHttpClient.get(
                VendorUris.build(URL, Map.of("code", code), Map.of("rt", System.currentTimeMillis())), REFERER);
    }

    @Override
    protected NormalizedQuote normalize(String raw, FetchRequest request) {
        JsonNode data;
        try {
            data = JsonHelper.readTree(JsonpParser.unwrap(raw));
        } catch (IllegalArgumentException e) {
            throw new SchemaException("fundgz payload is not JSON: " + e.getMessage(), e);
        }
        if (!data.isObject()) {
            throw new SchemaException("fundgz payload is not an object");
        }

        BigDecimal estimate = DecimalParser.parsePositive(text(data, "gsz"));
        BigDecimal lastNav = DecimalParser.parsePositive(text(data, "dwjz"));
        if (estimate == null && lastNav == null) {
            throw new SchemaException("fundgz payload has neither gsz nor dwjz");
        }
        LocalDate navDate = parseDate(text(data, "jzrq"));
        LocalDateTime asOf = parseDateTime(text(data, "gztime"));
        if (asOf == null && navDate != null) {
            asOf = navDate.atStartOfDay();
        }

        String code = text(data, "fundcode");
        return NormalizedQuote.builder()
                .code(code != null ? code : request.require("code"))
                .name(text(data, "name"))
                .price(estimate != null ? estimate : lastNav)
                .previousClose(lastNav)
                .changePct(estimate != null ? PercentParser.parse(text(data, "gszzl")) : null)
                .asOf(asOf)
                .navDate(navDate)
                .priceKind(estimate != null ? PriceKind.ESTIMATE : PriceKind.LAST_NAV)
                .source(SOURCE_NAME)
                .build();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static LocalDate parseDate(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(text.trim());
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static LocalDateTime parseDateTime(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return LocalDateTime.parse(text.trim(), GZTIME);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
