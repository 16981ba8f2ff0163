package com.fundfeed.unit.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import com.fundfeed.calendar.HolidayCalendarConfig;
import com.fundfeed.calendar.TradingCalendarService;
import com.fundfeed.domain.enums.DataType;
import com.fundfeed.domain.model.FetchRequest;
import com.fundfeed.domain.model.NavPoint;
import com.fundfeed.exception.SchemaException;
import com.fundfeed.provider.RetryPolicy;
import com.fundfeed.provider.VendorHttpClient;
import com.fundfeed.provider.eastmoney.PingzhongHistoryAdapter;
import java.net.URI;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PingzhongHistoryAdapterTest {

    private static final FetchRequest REQUEST = FetchRequest.of(DataType.FUND_HISTORY, "code", "005827");
    private static final ZoneId SHANGHAI = ZoneId.of("Asia/Shanghai");

    @Mock
    private VendorHttpClient vendorHttpClient;

    private PingzhongHistoryAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new PingzhongHistoryAdapter(
                vendorHttpClient,
                new RetryPolicy(1, List.of(Duration.ofMillis(1))),
                new TradingCalendarService(new HolidayCalendarConfig()));
    }

    private static long midnight(LocalDate date) {
        return date.atStartOfDay(SHANGHAI).toInstant().toEpochMilli();
    }

    @Test
    @DisplayName("Epoch-millisecond points become exchange-local NAV dates, ascending")
    void parsesSeries() {
        String script = "var fS_name = \"易方达蓝筹精选混合\";var fS_code = \"005827\";"
                + "var Data_netWorthTrend = ["
                + "{\"x\":" + midnight(LocalDate.of(2026, 3, 5)) + ",\"y\":2.1034,\"equityReturn\":0.5,"
                + "\"unitMoney\":\"\"},"
                + "{\"x\":" + midnight(LocalDate.of(2026, 3, 4)) + ",\"y\":2.0929,\"equityReturn\":-0.1,"
                + "\"unitMoney\":\"\"},"
                + "{\"x\":" + midnight(LocalDate.of(2026, 3, 3)) + ",\"y\":null}"
                + "];var Data_ACWorthTrend = [];";
        when(vendorHttpClient.get(any(URI.class), anyString())).thenReturn(script);

        List<NavPoint> series = adapter.fetch(REQUEST);

        assertThat(series).extracting(NavPoint::getDate)
                .containsExactly(LocalDate.of(2026, 3, 4), LocalDate.of(2026, 3, 5));
        assertThat(series.get(1).getClose()).isEqualByComparingTo("2.1034");
    }

    @Test
    @DisplayName("Script without the series variable is a schema failure")
    void missingSeries() {
        when(vendorHttpClient.get(any(URI.class), anyString())).thenReturn("var fS_code = \"005827\";");

        assertThatThrownBy(() -> adapter.fetch(REQUEST)).isInstanceOf(SchemaException.class);
    }
}
