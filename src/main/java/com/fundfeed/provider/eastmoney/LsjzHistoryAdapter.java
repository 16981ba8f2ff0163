package com.fundfeed.provider.eastmoney;

import com.fundfeed.calendar.TradingCalendarService;
import com.fundfeed.domain.enums.DataType;
import com.fundfeed.domain.model.FetchRequest;
import com.fundfeed.domain.model.NavPoint;
import com.fundfeed.provider.AbstractProviderAdapter;
import com.fundfeed.provider.RetryPolicy;
import com.fundfeed.provider.VendorHttpClient;
import com.fundfeed.provider.normalize.VendorTable;
import java.time.LocalDate;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * NAV history from the F10 lsjz table, limited to twice the requested lookback in calendar
 * days.
 */
@Component
public class LsjzHistoryAdapter extends AbstractProviderAdapter<VendorTable, List<NavPoint>> {

    public static final String SOURCE_NAME = "eastmoney_lsjz";

    private final LsjzClient lsjzClient;
    private final TradingCalendarService tradingCalendarService;

    public LsjzHistoryAdapter(
            VendorHttpClient vendorHttpClient,
            RetryPolicy retryPolicy,
            LsjzClient lsjzClient,
            TradingCalendarService tradingCalendarService) {
        super(vendorHttpClient, retryPolicy);
        this.lsjzClient = lsjzClient;
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
        return 100;
    }

    @Override
    protected boolean retriesEachCall() {
        return true;
    }

    @Override
    protected VendorTable fetchRaw(FetchRequest request) {
        int lookbackDays = Integer.parseInt(request.get("lookbackDays", "180"));
        LocalDate today = LocalDate.now(tradingCalendarService.zone());
        LocalDate startDate = lookbackDays > 0 ? today.minusDays(lookbackDays * 2L) : null;
        int maxRows = lookbackDays > 0 ? lookbackDays * 2 : LsjzClient.PAGE_SIZE * LsjzClient.MAX_PAGES;
        return lsjzClient.fetchRows(SOURCE_NAME, request.require("code"), startDate, maxRows);
    }

    @Override
    protected List<NavPoint> normalize(VendorTable raw, FetchRequest request) {
        return LsjzClient.toNavPoints(raw);
    }
}
