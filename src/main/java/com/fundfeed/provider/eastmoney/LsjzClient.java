package com.fundfeed.provider.eastmoney;

import com.fasterxml.jackson.databind.JsonNode;
import com.fundfeed.domain.model.NavPoint;
import com.fundfeed.exception.SchemaException;
import com.fundfeed.exception.UpstreamRejectedException;
import com.fundfeed.mapper.JsonHelper;
import com.fundfeed.provider.RetryPolicy;
import com.fundfeed.provider.VendorHttpClient;
import com.fundfeed.provider.VendorUris;
import com.fundfeed.provider.normalize.ColumnResolver;
import com.fundfeed.provider.normalize.ColumnSpec;
import com.fundfeed.provider.normalize.DecimalParser;
import com.fundfeed.provider.normalize.VendorTable;
import java.math.BigDecimal;
import java.net.URI;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Reader for the F10 {@code lsjz} NAV history table, shared by the history adapter and the
 * last-NAV quote adapter.
 *
 * <p>Response shape: {@code {"Data":{"LSJZList":[{"FSRQ":"2024-01-05","DWJZ":"1.2345",
 * "JZZZL":"0.45",...}]},"ErrCode":0,"TotalCount":1234,"PageSize":20,"PageIndex":1}}.
 * Rows arrive newest first.
 *
 * <p>Each page request is retried on its own, so a transient failure on a later page does
 * not fetch the earlier pages again.
 */
@Component
public class LsjzClient {

    static final String URL = "https://api.fund.eastmoney.com/f10/lsjz";
    static final String REFERER = "https://fundf10.eastmoney.com/";

    /** The endpoint silently caps larger page sizes. */
    static final int PAGE_SIZE = 20;

    static final int MAX_PAGES = 60;

    static final ColumnSpec DATE = ColumnSpec.of("date", "FSRQ", "净值日期", "日期");
    static final ColumnSpec NAV = ColumnSpec.of("nav", "DWJZ", "单位净值");
    static final ColumnSpec CHANGE_PCT = ColumnSpec.of("changePct", "JZZZL", "日增长率");

    private final VendorHttpClient vendorHttpClient;
    private final RetryPolicy retryPolicy;

    public LsjzClient(VendorHttpClient vendorHttpClient, RetryPolicy retryPolicy) {
        this.vendorHttpClient = vendorHttpClient;
        this.retryPolicy = retryPolicy;
    }

    /**
     * Fetches rows dated on or after {@code startDate} (all rows when null), following pages
     * until TotalCount is reached, a page comes back empty, or {@code maxRows} rows are held.
     * Retries are attributed to {@code sourceName}.
     */
    public VendorTable fetchRows(String sourceName, String code, LocalDate startDate, int maxRows) {
        List<Map<String, Object>> rows = new ArrayList<>();
        int pageSize = Math.min(PAGE_SIZE, Math.max(1, maxRows));
        for (int pageIndex = 1; pageIndex <= MAX_PAGES; pageIndex++) {
            Map<String, Object> query = new LinkedHashMap<>();
            query.put("fundCode", code);
            query.put("pageIndex", pageIndex);
            query.put("pageSize", pageSize);
            query.put("startDate", startDate != null ? startDate.toString() : "");
            query.put("endDate", "");
            query.put("_", System.currentTimeMillis());
            URI uri = VendorUris.build(URL, query);
            String body = retryPolicy.execute(sourceName, () -> vendorHttpClient.get(uri, REFERER));

            JsonNode root = parse(body);
            List<Map<String, Object>> page = pageRows(root);
            rows.addAll(page);
            int total = root.path("TotalCount").asInt(0);
            if (page.isEmpty() || rows.size() >= total || rows.size() >= maxRows) {
                break;
            }
        }
        return VendorTable.fromRows(rows);
    }

    /** Converts lsjz rows into an ascending NAV series, skipping rows without a date or a positive NAV. */
    public static List<NavPoint> toNavPoints(VendorTable table) {
        if (table.isEmpty()) {
            return List.of();
        }
        String dateCol = ColumnResolver.require(table.getColumns(), DATE);
        String navCol = ColumnResolver.require(table.getColumns(), NAV);
        Map<LocalDate, NavPoint> byDate = new LinkedHashMap<>();
        for (Map<String, Object> row : table.getRows()) {
            LocalDate date = parseDate(row.get(dateCol));
            BigDecimal nav = DecimalParser.parsePositive(row.get(navCol));
            if (date != null && nav != null) {
                byDate.putIfAbsent(date, new NavPoint(date, nav));
            }
        }
        List<NavPoint> points = new ArrayList<>(byDate.values());
        points.sort(Comparator.comparing(NavPoint::getDate));
        return points;
    }

    static Optional<String> changePctColumn(VendorTable table) {
        return ColumnResolver.resolve(table.getColumns(), CHANGE_PCT);
    }

    static LocalDate parseDate(Object raw) {
        if (raw == null) {
            return null;
        }
        String text = raw.toString().trim();
        if (text.length() > 10) {
            text = text.substring(0, 10);
        }
        try {
            return LocalDate.parse(text);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static JsonNode parse(String body) {
        JsonNode root;
        try {
            root = JsonHelper.readTree(body);
        } catch (IllegalArgumentException e) {
            throw new SchemaException("lsjz response is not JSON: " + e.getMessage(), e);
        }
        int errCode = root.path("ErrCode").asInt(0);
        if (errCode != 0) {
            throw new UpstreamRejectedException(
                    "lsjz rejected request: ErrCode " + errCode + " " + root.path("ErrMsg").asText(""));
        }
        return root;
    }

    private static List<Map<String, Object>> pageRows(JsonNode root) {
        JsonNode list = root.path("Data").path("LSJZList");
        if (!list.isArray()) {
            throw new SchemaException("lsjz response has no Data.LSJZList array");
        }
        List<Map<String, Object>> rows = new ArrayList<>();
        for (JsonNode item : list) {
            Map<String, Object> row = new LinkedHashMap<>();
            item.fields().forEachRemaining(field -> row.put(
                    field.getKey(), field.getValue().isNull() ? null : field.getValue().asText()));
            rows.add(row);
        }
        return rows;
    }
}
