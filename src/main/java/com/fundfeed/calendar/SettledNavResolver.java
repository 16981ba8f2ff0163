package com.fundfeed.calendar;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fundfeed.config.TtlConfig;
import com.fundfeed.domain.enums.DataType;
import com.fundfeed.domain.model.FetchRequest;
import com.fundfeed.domain.model.FetchResult;
import com.fundfeed.domain.model.NavPoint;
import com.fundfeed.domain.model.SettledNav;
import com.fundfeed.pipeline.FetchPipeline;
import com.fundfeed.provider.ProviderAdapter;
import com.fundfeed.provider.ProviderCatalog;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Looks up the authoritative NAV for a date, and the NAV before it, from the history series.
 *
 * <p>Reads go through the {@link FetchPipeline} under the FUND_HISTORY data type, so the series
 * is cached and falls back across history sources like any other history request.
 */
@Component
public class SettledNavResolver {

    private static final Logger log = LoggerFactory.getLogger(SettledNavResolver.class);

    static final int LOOKBACK_DAYS = 30;

    private static final TypeReference<List<NavPoint>> NAV_SERIES = new TypeReference<>() {};

    private final FetchPipeline fetchPipeline;
    private final ProviderCatalog providerCatalog;
    private final TtlConfig ttlConfig;

    public SettledNavResolver(FetchPipeline fetchPipeline, ProviderCatalog providerCatalog, TtlConfig ttlConfig) {
        this.fetchPipeline = fetchPipeline;
        this.providerCatalog = providerCatalog;
        this.ttlConfig = ttlConfig;
    }

    public Optional<SettledNav> resolve(String code, LocalDate navDate) {
        FetchRequest request = FetchRequest.of(
                DataType.FUND_HISTORY, Map.of("code", code, "lookbackDays", String.valueOf(LOOKBACK_DAYS)));
        List<ProviderAdapter<List<NavPoint>>> adapters = providerCatalog.forDataType(DataType.FUND_HISTORY);
        FetchResult<List<NavPoint>> history = fetchPipeline.fetch(
                request, adapters, series -> !series.isEmpty(), ttlConfig.getFundHistory(), NAV_SERIES);
        if (!history.isPresent()) {
            log.debug("No history for {}, keeping estimate", code);
            return Optional.empty();
        }
        return findSettled(history.getValue(), navDate);
    }

    /** Finds the point dated {@code navDate} in an ascending series and pairs it with its predecessor. */
    static Optional<SettledNav> findSettled(List<NavPoint> series, LocalDate navDate) {
        for (int i = series.size() - 1; i >= 0; i--) {
            NavPoint point = series.get(i);
            if (!point.getDate().equals(navDate)) {
                continue;
            }
            BigDecimal previous = i > 0 ? series.get(i - 1).getClose() : null;
            BigDecimal changePct = previous != null && previous.signum() != 0
                    ? point.getClose()
                            .subtract(previous)
                            .multiply(BigDecimal.valueOf(100))
                            .divide(previous, 2, RoundingMode.HALF_UP)
                    : null;
            return Optional.of(SettledNav.builder()
                    .navDate(navDate)
                    .nav(point.getClose())
                    .previousNav(previous)
                    .changePct(changePct)
                    .build());
        }
        return Optional.empty();
    }
}
