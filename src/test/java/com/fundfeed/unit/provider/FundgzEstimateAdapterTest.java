package com.fundfeed.unit.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fundfeed.domain.enums.DataType;
import com.fundfeed.domain.enums.PriceKind;
import com.fundfeed.domain.model.FetchRequest;
import com.fundfeed.domain.model.NormalizedQuote;
import com.fundfeed.exception.SchemaException;
import com.fundfeed.exception.TransientNetworkException;
import com.fundfeed.provider.RetryPolicy;
import com.fundfeed.provider.VendorHttpClient;
import com.fundfeed.provider.eastmoney.FundgzEstimateAdapter;
import java.net.URI;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/** Unit tests for FundgzEstimateAdapter parsing canned fundgz JSONP payloads. */
@ExtendWith(MockitoExtension.class)
class FundgzEstimateAdapterTest {

    private static final FetchRequest REQUEST = FetchRequest.of(DataType.FUND_REALTIME, "code", "008888");

    @Mock
    private VendorHttpClient vendorHttpClient;

    private FundgzEstimateAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new FundgzEstimateAdapter(vendorHttpClient, new RetryPolicy(3, List.of(Duration.ofMillis(1))));
    }

    @Test
    @DisplayName("Estimate payload becomes an ESTIMATE quote")
    void parsesEstimate() {
        when(vendorHttpClient.get(any(URI.class), anyString()))
                .thenReturn("jsonpgz({\"fundcode\":\"008888\",\"name\":\"华夏国证半导体芯片ETF联接C\","
                        + "\"jzrq\":\"2026-03-05\",\"dwjz\":\"1.2345\",\"gsz\":\"1.2400\",\"gszzl\":\"0.45\","
                        + "\"gztime\":\"2026-03-06 14:30\"});");

        NormalizedQuote quote = adapter.fetch(REQUEST);

        assertThat(quote.getCode()).isEqualTo("008888");
        assertThat(quote.getName()).isEqualTo("华夏国证半导体芯片ETF联接C");
        assertThat(quote.getPrice()).isEqualByComparingTo("1.2400");
        assertThat(quote.getPreviousClose()).isEqualByComparingTo("1.2345");
        assertThat(quote.getChangePct()).isEqualByComparingTo("0.45");
        assertThat(quote.getAsOf()).isEqualTo(LocalDateTime.of(2026, 3, 6, 14, 30));
        assertThat(quote.getNavDate()).isEqualTo(LocalDate.of(2026, 3, 5));
        assertThat(quote.getPriceKind()).isEqualTo(PriceKind.ESTIMATE);
        assertThat(quote.getSource()).isEqualTo(FundgzEstimateAdapter.SOURCE_NAME);
    }

    @Test
    @DisplayName("Request goes to the fund's script with the fund page as referer")
    void requestShape() {
        when(vendorHttpClient.get(any(URI.class), anyString()))
                .thenReturn("jsonpgz({\"fundcode\":\"008888\",\"dwjz\":\"1.2\",\"gsz\":\"1.3\"});");

        adapter.fetch(REQUEST);

        ArgumentCaptor<URI> uri = ArgumentCaptor.forClass(URI.class);
        verify(vendorHttpClient).get(uri.capture(), eq("https://fund.eastmoney.com/"));
        assertThat(uri.getValue().getHost()).isEqualTo("fundgz.1234567.com.cn");
        assertThat(uri.getValue().getPath()).isEqualTo("/js/008888.js");
        assertThat(uri.getValue().getQuery()).startsWith("rt=");
    }

    @Test
    @DisplayName("Missing estimate falls back to the last NAV without a change percentage")
    void fallsBackToLastNav() {
        when(vendorHttpClient.get(any(URI.class), anyString()))
                .thenReturn("jsonpgz({\"fundcode\":\"008888\",\"jzrq\":\"2026-03-05\",\"dwjz\":\"1.2345\","
                        + "\"gsz\":\"\",\"gszzl\":\"\",\"gztime\":\"\"});");

        NormalizedQuote quote = adapter.fetch(REQUEST);

        assertThat(quote.getPrice()).isEqualByComparingTo("1.2345");
        assertThat(quote.getPriceKind()).isEqualTo(PriceKind.LAST_NAV);
        assertThat(quote.getChangePct()).isNull();
        assertThat(quote.getAsOf()).isEqualTo(LocalDate.of(2026, 3, 5).atStartOfDay());
    }

    @Test
    @DisplayName("Empty callback for an unestimated fund is a schema failure, not retried")
    void emptyCallback() {
        when(vendorHttpClient.get(any(URI.class), anyString())).thenReturn("jsonpgz();");

        assertThatThrownBy(() -> adapter.fetch(REQUEST)).isInstanceOf(SchemaException.class);
        verify(vendorHttpClient, times(1)).get(any(URI.class), anyString());
    }

    @Test
    @DisplayName("Payload without any price is a schema failure")
    void noPrice() {
        when(vendorHttpClient.get(any(URI.class), anyString()))
                .thenReturn("jsonpgz({\"fundcode\":\"008888\",\"dwjz\":\"--\",\"gsz\":\"0\"});");

        assertThatThrownBy(() -> adapter.fetch(REQUEST)).isInstanceOf(SchemaException.class);
    }

    @Test
    @DisplayName("Transient failures are retried before succeeding")
    void retriesTransientFailures() {
        when(vendorHttpClient.get(any(URI.class), anyString()))
                .thenThrow(new TransientNetworkException("reset"))
                .thenThrow(new TransientNetworkException("reset"))
                .thenReturn("jsonpgz({\"fundcode\":\"008888\",\"dwjz\":\"1.2\",\"gsz\":\"1.3\"});");

        assertThat(adapter.fetch(REQUEST).getPrice()).isEqualByComparingTo("1.3");
        verify(vendorHttpClient, times(3)).get(any(URI.class), anyString());
    }
}
