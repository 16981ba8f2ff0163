package com.fundfeed.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fundfeed.calendar.SettledNavResolver;
import com.fundfeed.calendar.TradingCalendarService;
import com.fundfeed.config.TtlConfig;
import com.fundfeed.domain.enums.DataType;
import com.fundfeed.domain.enums.FlowPeriod;
import com.fundfeed.domain.enums.PriceKind;
import com.fundfeed.domain.enums.SectorKind;
import com.fundfeed.domain.model.FetchRequest;
import com.fundfeed.domain.model.FetchResult;
import com.fundfeed.domain.model.NavPoint;
import com.fundfeed.domain.model.NormalizedQuote;
import com.fundfeed.domain.model.SectorFlowItem;
import com.fundfeed.domain.model.SettledNav;
import com.fundfeed.exception.BusinessException;
import com.fundfeed.pipeline.FetchPipeline;
import com.fundfeed.provider.ProviderCatalog;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for collaborators that need fund market data.
 *
 * <p>Every call is best-effort: it returns whatever the {@link FetchPipeline} could obtain
 * (fresh, from a live source, or stale) and reports "nothing available" as an empty result
 * rather than an exception. Only malformed arguments are rejected.
 *
 * <p>Latest quotes are post-processed for settlement: once the NAV an estimate refers to is
 * the newest one expected to be published, the estimate is replaced by the settled NAV.
 */
@Service
public class MarketDataService {

    private static final Logger log = LoggerFactory.getLogger(MarketDataService.class);

    public static final int DEFAULT_LOOKBACK_DAYS = 180;
    public static final int MAX_TOP_N = 200;

    private static final TypeReference<NormalizedQuote> QUOTE = new TypeReference<>() {};
    private static final TypeReference<List<NavPoint>> NAV_SERIES = new TypeReference<>() {};
    private static final TypeReference<List<SectorFlowItem>> SECTOR_FLOW = new TypeReference<>() {};

    private final FetchPipeline fetchPipeline;
    private final ProviderCatalog providerCatalog;
    private final TradingCalendarService tradingCalendarService;
    private final SettledNavResolver settledNavResolver;
    private final TtlConfig ttlConfig;

    public MarketDataService(
            FetchPipeline fetchPipeline,
            ProviderCatalog providerCatalog,
            TradingCalendarService tradingCalendarService,
            SettledNavResolver settledNavResolver,
            TtlConfig ttlConfig) {
        this.fetchPipeline = fetchPipeline;
        this.providerCatalog = providerCatalog;
        this.tradingCalendarService = tradingCalendarService;
        this.settledNavResolver = settledNavResolver;
        this.ttlConfig = ttlConfig;
    }

    /** Latest price for a fund, or empty when no source and no cache could answer. */
    public Optional<NormalizedQuote> getLatestQuote(String code) {
        FetchResult<NormalizedQuote> result = fetchLatestQuote(code);
        return Optional.ofNullable(result.getValue());
    }

    public FetchResult<NormalizedQuote> fetchLatestQuote(String code) {
        return fetchLatestQuote(code, Instant.now());
    }

    /** Testable version: settlement is judged relative to {@code now}. */
    public FetchResult<NormalizedQuote> fetchLatestQuote(String code, Instant now) {
        String fundCode = normalizeCode(code);
        FetchResult<NormalizedQuote> result = fetchPipeline.fetch(
                FetchRequest.of(DataType.FUND_REALTIME, "code", fundCode),
                providerCatalog.forDataType(DataType.FUND_REALTIME),
                quote -> quote.getPrice() != null && quote.getPrice().signum() > 0,
                ttlConfig.getFundRealtime(),
                QUOTE);
        if (!result.isPresent()) {
            return result;
        }
        NormalizedQuote quote = result.getValue();
        if (quote.getPriceKind() != PriceKind.ESTIMATE || !tradingCalendarService.isSettled(quote.getNavDate(), now)) {
            return result;
        }
        Optional<SettledNav> settled = settledNavResolver.resolve(fundCode, quote.getNavDate());
        if (settled.isEmpty()) {
            return result;
        }
        log.debug("NAV for {} settled on {}, replacing estimate", fundCode, quote.getNavDate());
        return result.withValue(applySettlement(quote, settled.get()));
    }

    /** NAV history, ascending, covering at most {@code lookbackDays * 2} calendar days. */
    public List<NavPoint> getHistory(String code, int lookbackDays) {
        FetchResult<List<NavPoint>> result = fetchHistory(code, lookbackDays);
        return result.isPresent() ? result.getValue() : List.of();
    }

    public FetchResult<List<NavPoint>> fetchHistory(String code, int lookbackDays) {
        if (lookbackDays < 1) {
            throw new BusinessException(
                    "lookbackDays must be positive, got " + lookbackDays,
                    Map.of("lookbackDays", lookbackDays, "min", 1));
        }
        String fundCode = normalizeCode(code);
        FetchResult<List<NavPoint>> result = fetchPipeline.fetch(
                FetchRequest.of(
                        DataType.FUND_HISTORY, Map.of("code", fundCode, "lookbackDays", String.valueOf(lookbackDays))),
                providerCatalog.forDataType(DataType.FUND_HISTORY),
                MarketDataService::isUsableSeries,
                ttlConfig.getFundHistory(),
                NAV_SERIES);
        if (!result.isPresent()) {
            return result;
        }
        return result.withValue(trimToLookback(result.getValue(), lookbackDays));
    }

    /** Today's sector fund-flow ranking, largest main net inflow first. */
    public List<SectorFlowItem> getSectorFlowRanking(SectorKind kind, int topN) {
        FetchResult<List<SectorFlowItem>> result = fetchSectorFlowRanking(kind, FlowPeriod.TODAY, topN);
        return result.isPresent() ? result.getValue() : List.of();
    }

    public FetchResult<List<SectorFlowItem>> fetchSectorFlowRanking(SectorKind kind, FlowPeriod period, int topN) {
        if (topN < 1 || topN > MAX_TOP_N) {
            throw new BusinessException(
                    "topN must be between 1 and " + MAX_TOP_N + ", got " + topN,
                    Map.of("topN", topN, "min", 1, "max", MAX_TOP_N));
        }
        FetchResult<List<SectorFlowItem>> result = fetchPipeline.fetch(
                FetchRequest.of(DataType.SECTOR_FLOW, Map.of("kind", kind.name(), "period", period.name())),
                providerCatalog.forDataType(DataType.SECTOR_FLOW),
                items -> !items.isEmpty(),
                ttlConfig.getSectorFlow(),
                SECTOR_FLOW);
        if (!result.isPresent()) {
            return result;
        }
        List<SectorFlowItem> items = result.getValue();
        return result.withValue(items.size() <= topN ? items : List.copyOf(items.subList(0, topN)));
    }

    /**
     * Trims and left-pads numeric fund codes to six digits ({@code "8888"} becomes
     * {@code "008888"}).
     */
    public static String normalizeCode(String code) {
        if (code == null || code.isBlank()) {
            throw new BusinessException("Fund code must not be blank");
        }
        String trimmed = code.trim();
        if (!trimmed.chars().allMatch(Character::isDigit) || trimmed.length() > 6) {
            throw new BusinessException(
                    "Fund code must be up to six digits, got '" + trimmed + "'", Map.of("code", trimmed));
        }
        return "0".repeat(6 - trimmed.length()) + trimmed;
    }

    static boolean isUsableSeries(List<NavPoint> series) {
        return !series.isEmpty()
                && series.stream().allMatch(p -> p.getClose() != null && p.getClose().signum() > 0);
    }

    static List<NavPoint> trimToLookback(List<NavPoint> series, int lookbackDays) {
        if (series.isEmpty()) {
            return series;
        }
        LocalDate newest = series.get(series.size() - 1).getDate();
        LocalDate start = newest.minusDays(lookbackDays * 2L);
        return series.stream().filter(p -> !p.getDate().isBefore(start)).collect(Collectors.toList());
    }

    static NormalizedQuote applySettlement(NormalizedQuote estimate, SettledNav settled) {
        BigDecimal previous = settled.getPreviousNav();
        return estimate.toBuilder()
                .price(settled.getNav())
                .previousClose(previous)
                .changePct(settled.getChangePct())
                .asOf(settled.getNavDate().atStartOfDay())
                .navDate(settled.getNavDate())
                .priceKind(PriceKind.SETTLED)
                .build();
    }
}
