package com.fundfeed.provider.tushare;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fundfeed.calendar.TradingCalendarService;
import com.fundfeed.domain.enums.DataType;
import com.fundfeed.domain.enums.FlowPeriod;
import com.fundfeed.domain.enums.SectorKind;
import com.fundfeed.domain.model.FetchRequest;
import com.fundfeed.domain.model.SectorFlowItem;
import com.fundfeed.exception.SchemaException;
import com.fundfeed.exception.UpstreamRejectedException;
import com.fundfeed.mapper.JsonHelper;
import com.fundfeed.provider.AbstractProviderAdapter;
import com.fundfeed.provider.RetryPolicy;
import com.fundfeed.provider.VendorHttpClient;
import com.fundfeed.provider.normalize.AmountUnit;
import com.fundfeed.provider.normalize.DecimalParser;
import com.fundfeed.provider.normalize.SectorFlowNormalizer;
import com.fundfeed.provider.normalize.VendorTable;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.net.URI;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Sector fund-flow ranking from Tushare Pro's {@code moneyflow_ind_dc} table.
 *
 * <p>Multi-day periods are aggregated client-side: the last N open dates come from
 * {@code trade_cal}, net inflow is summed per board and the net-inflow ratio averaged over the
 * dates fetched. The change percentage is the one reported on the earliest date. The
 * aggregate is handed to {@link SectorFlowNormalizer} under the same headers the Eastmoney
 * tables use.
 */
@Component
public class TushareSectorFlowAdapter
        extends AbstractProviderAdapter<TushareSectorFlowAdapter.DailyTables, List<SectorFlowItem>> {

    public static final String SOURCE_NAME = "tushare";

    static final String REFERER = "https://tushare.pro/";
    static final DateTimeFormatter BASIC_DATE = DateTimeFormatter.BASIC_ISO_DATE;
    static final String MONEYFLOW_FIELDS =
            "trade_date,content_type,ts_code,name,pct_change,close,net_amount,net_amount_rate,rank";

    private final TushareConfig tushareConfig;
    private final TradingCalendarService tradingCalendarService;

    public TushareSectorFlowAdapter(
            VendorHttpClient vendorHttpClient,
            RetryPolicy retryPolicy,
            TushareConfig tushareConfig,
            TradingCalendarService tradingCalendarService) {
        super(vendorHttpClient, retryPolicy);
        this.tushareConfig = tushareConfig;
        this.tradingCalendarService = tradingCalendarService;
    }

    @Override
    public String sourceName() {
        return SOURCE_NAME;
    }

    @Override
    public DataType dataType() {
        return DataType.SECTOR_FLOW;
    }

    @Override
    public int defaultPriority() {
        return 90;
    }

    @Override
    public boolean isConfigured() {
        return tushareConfig.hasToken();
    }

    @Override
    protected DailyTables fetchRaw(FetchRequest request) {
        SectorKind kind = SectorKind.valueOf(request.require("kind"));
        FlowPeriod period = FlowPeriod.valueOf(request.require("period"));

        List<String> dates = lastTradeDates(period.getTradingDays());
        if (dates.isEmpty()) {
            throw new SchemaException("trade_cal returned no open dates");
        }
        List<VendorTable> tables = new ArrayList<>();
        for (String date : dates) {
            Map<String, Object> params = new LinkedHashMap<>();
            params.put("trade_date", date);
            params.put("content_type", kind.getShortLabel());
            tables.add(query("moneyflow_ind_dc", params, MONEYFLOW_FIELDS));
        }
        return new DailyTables(dates, tables);
    }

    @Override
    protected List<SectorFlowItem> normalize(DailyTables raw, FetchRequest request) {
        FlowPeriod period = FlowPeriod.valueOf(request.require("period"));
        Map<String, Map<String, Object>> byCode = new LinkedHashMap<>();
        Map<String, BigDecimal> rateSums = new LinkedHashMap<>();

        for (VendorTable table : raw.getTables()) {
            for (Map<String, Object> row : table.getRows()) {
                Object tsCode = row.get("ts_code");
                if (tsCode == null || tsCode.toString().isBlank()) {
                    continue;
                }
                String code = tsCode.toString().trim();
                Map<String, Object> agg = byCode.computeIfAbsent(code, k -> {
                    Map<String, Object> fresh = new LinkedHashMap<>();
                    fresh.put("板块代码", k);
                    fresh.put("板块名称", row.get("name"));
                    fresh.put("涨跌幅", row.get("pct_change"));
                    fresh.put("主力净流入-净额", BigDecimal.ZERO);
                    return fresh;
                });
                BigDecimal net = DecimalParser.parse(row.get("net_amount"));
                if (net != null) {
                    agg.put("主力净流入-净额", ((BigDecimal) agg.get("主力净流入-净额")).add(net));
                }
                BigDecimal rate = DecimalParser.parse(row.get("net_amount_rate"));
                if (rate != null) {
                    rateSums.merge(code, rate, BigDecimal::add);
                }
            }
        }
        if (byCode.isEmpty()) {
            throw new SchemaException("moneyflow_ind_dc returned no rows for " + raw.getDates());
        }

        BigDecimal dateCount = BigDecimal.valueOf(Math.max(1, raw.getDates().size()));
        List<Map<String, Object>> rows = new ArrayList<>();
        byCode.forEach((code, agg) -> {
            BigDecimal rateSum = rateSums.get(code);
            agg.put("主力净流入-净占比", rateSum != null ? rateSum.divide(dateCount, 4, RoundingMode.HALF_UP) : null);
            agg.put("主力净流入-净额", ((BigDecimal) agg.get("主力净流入-净额")).toPlainString());
            rows.add(agg);
        });
        return SectorFlowNormalizer.normalize(VendorTable.fromRows(rows), period, AmountUnit.YUAN);
    }

    /** Open SSE dates up to today, oldest first, at most {@code n}. */
    List<String> lastTradeDates(int n) {
        LocalDate today = LocalDate.now(tradingCalendarService.zone());
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("exchange", "SSE");
        params.put("start_date", today.minusDays(Math.max(20, n * 10L)).format(BASIC_DATE));
        params.put("end_date", today.format(BASIC_DATE));
        VendorTable calendar = query("trade_cal", params, "cal_date,is_open");

        List<String> open = new ArrayList<>();
        for (Map<String, Object> row : calendar.getRows()) {
            Object isOpen = row.get("is_open");
            if (isOpen != null && "1".equals(isOpen.toString().trim())) {
                open.add(row.get("cal_date").toString());
            }
        }
        open.sort(String::compareTo);
        return open.subList(Math.max(0, open.size() - n), open.size());
    }

    /** One Tushare API call; a non-zero {@code code} is an upstream rejection. */
    VendorTable query(String apiName, Map<String, Object> params, String fields) {
        ObjectNode body = JsonHelper.createObjectNode();
        body.put("api_name", apiName);
        body.put("token", tushareConfig.getToken());
        body.set("params", JsonHelper.valueToTree(params));
        body.put("fields", fields);

        String response =
                vendorHttpClient.postJson(URI.create(tushareConfig.getUrl()), REFERER, JsonHelper.toJson(body));
        JsonNode root;
        try {
            root = JsonHelper.readTree(response);
        } catch (IllegalArgumentException e) {
            throw new SchemaException("Tushare " + apiName + " response is not JSON: " + e.getMessage(), e);
        }
        int code = root.path("code").asInt(-1);
        if (code != 0) {
            throw new UpstreamRejectedException(
                    "Tushare " + apiName + " rejected: code " + code + " " + root.path("msg").asText(""));
        }
        JsonNode fieldNames = root.path("data").path("fields");
        JsonNode items = root.path("data").path("items");
        if (!fieldNames.isArray() || !items.isArray()) {
            throw new SchemaException("Tushare " + apiName + " response has no data.fields/items");
        }
        List<String> columns = new ArrayList<>();
        fieldNames.forEach(f -> columns.add(f.asText()));
        List<List<Object>> values = new ArrayList<>();
        for (JsonNode item : items) {
            List<Object> row = new ArrayList<>();
            item.forEach(cell -> row.add(cell.isNull() ? null : cell.asText()));
            values.add(row);
        }
        return VendorTable.fromColumns(columns, values);
    }

    /** Per-date moneyflow tables, dates ascending. */
    public static final class DailyTables {

        private final List<String> dates;
        private final List<VendorTable> tables;

        DailyTables(List<String> dates, List<VendorTable> tables) {
            this.dates = List.copyOf(dates);
            this.tables = List.copyOf(tables);
        }

        public List<String> getDates() {
            return dates;
        }

        public List<VendorTable> getTables() {
            return tables;
        }
    }
}
