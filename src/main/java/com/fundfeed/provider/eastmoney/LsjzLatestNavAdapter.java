package com.fundfeed.provider.eastmoney;

import com.fundfeed.domain.enums.DataType;
import com.fundfeed.domain.enums.PriceKind;
import com.fundfeed.domain.model.FetchRequest;
import com.fundfeed.domain.model.NavPoint;
import com.fundfeed.domain.model.NormalizedQuote;
import com.fundfeed.exception.SchemaException;
import com.fundfeed.provider.AbstractProviderAdapter;
import com.fundfeed.provider.RetryPolicy;
import com.fundfeed.provider.VendorHttpClient;
import com.fundfeed.provider.normalize.ColumnResolver;
import com.fundfeed.provider.normalize.PercentParser;
import com.fundfeed.provider.normalize.VendorTable;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Fallback quote: the most recent published NAV from the lsjz table. Used when no intraday
 * estimate is available (QDII and bond funds, or the estimate endpoint is down).
 */
@Component
public class LsjzLatestNavAdapter extends AbstractProviderAdapter<VendorTable, NormalizedQuote> {

    public static final String SOURCE_NAME = "eastmoney_lsjz_latest";

    private final LsjzClient lsjzClient;

    public LsjzLatestNavAdapter(VendorHttpClient vendorHttpClient, RetryPolicy retryPolicy, LsjzClient lsjzClient) {
        super(vendorHttpClient, retryPolicy);
        this.lsjzClient = lsjzClient;
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
        return 80;
    }

    @Override
    protected boolean retriesEachCall() {
        return true;
    }

    @Override
    protected VendorTable fetchRaw(FetchRequest request) {
        return lsjzClient.fetchRows(SOURCE_NAME, request.require("code"), null, 2);
    }

    @Override
    protected NormalizedQuote normalize(VendorTable raw, FetchRequest request) {
        List<NavPoint> points = LsjzClient.toNavPoints(raw);
        if (points.isEmpty()) {
            throw new SchemaException("lsjz returned no usable NAV rows for " + request.require("code"));
        }
        NavPoint latest = points.get(points.size() - 1);
        BigDecimal previous = points.size() > 1 ? points.get(points.size() - 2).getClose() : null;

        BigDecimal changePct = reportedChangePct(raw, latest);
        if (changePct == null && previous != null) {
            changePct = percentChange(latest.getClose(), previous);
        }

        return NormalizedQuote.builder()
                .code(request.require("code"))
                .price(latest.getClose())
                .previousClose(previous)
                .changePct(changePct)
                .asOf(latest.getDate().atStartOfDay())
                .navDate(latest.getDate())
                .priceKind(PriceKind.LAST_NAV)
                .source(SOURCE_NAME)
                .build();
    }

    /** The vendor's own daily growth figure for the latest row, when present. */
    private static BigDecimal reportedChangePct(VendorTable raw, NavPoint latest) {
        Optional<String> pctCol = LsjzClient.changePctColumn(raw);
        Optional<String> dateCol = ColumnResolver.resolve(raw.getColumns(), LsjzClient.DATE);
        if (pctCol.isEmpty() || dateCol.isEmpty()) {
            return null;
        }
        for (Map<String, Object> row : raw.getRows()) {
            if (latest.getDate().equals(LsjzClient.parseDate(row.get(dateCol.get())))) {
                return PercentParser.parse(row.get(pctCol.get()));
            }
        }
        return null;
    }

    static BigDecimal percentChange(BigDecimal current, BigDecimal previous) {
        if (previous == null || previous.signum() == 0) {
            return null;
        }
        return current.subtract(previous)
                .multiply(BigDecimal.valueOf(100))
                .divide(previous, 2, RoundingMode.HALF_UP);
    }
}
