package com.fundfeed.api.controller;

import com.fundfeed.api.dto.response.MarketDataResponse;
import com.fundfeed.domain.enums.FlowPeriod;
import com.fundfeed.domain.enums.SectorKind;
import com.fundfeed.domain.model.NavPoint;
import com.fundfeed.domain.model.NormalizedQuote;
import com.fundfeed.domain.model.SectorFlowItem;
import com.fundfeed.service.MarketDataService;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints exposing the market data facade for inspection.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/market-data/quotes/{code} -- latest quote (estimate, settled NAV or last NAV)</li>
 *   <li>GET /api/market-data/history/{code} -- NAV history, ascending</li>
 *   <li>GET /api/market-data/sector-flow -- sector fund-flow ranking</li>
 * </ul>
 *
 * <p>Data that cannot be obtained is reported with {@code available=false}, never as an error.
 */
@RestController
@RequestMapping("/api/market-data")
public class MarketDataController {

    private final MarketDataService marketDataService;

    public MarketDataController(MarketDataService marketDataService) {
        this.marketDataService = marketDataService;
    }

    @GetMapping("/quotes/{code}")
    public ResponseEntity<MarketDataResponse<NormalizedQuote>> getQuote(@PathVariable String code) {
        return ResponseEntity.ok(MarketDataResponse.from(marketDataService.fetchLatestQuote(code)));
    }

    @GetMapping("/history/{code}")
    public ResponseEntity<MarketDataResponse<List<NavPoint>>> getHistory(
            @PathVariable String code,
            @RequestParam(defaultValue = "" + MarketDataService.DEFAULT_LOOKBACK_DAYS) int lookbackDays) {
        return ResponseEntity.ok(MarketDataResponse.from(marketDataService.fetchHistory(code, lookbackDays)));
    }

    /**
     * Sector ranking by main net inflow, largest first. {@code kind} is INDUSTRY, CONCEPT or
     * REGION; {@code period} is TODAY, FIVE_DAY or TEN_DAY.
     */
    @GetMapping("/sector-flow")
    public ResponseEntity<MarketDataResponse<List<SectorFlowItem>>> getSectorFlow(
            @RequestParam(defaultValue = "INDUSTRY") SectorKind kind,
            @RequestParam(defaultValue = "TODAY") FlowPeriod period,
            @RequestParam(defaultValue = "30") int topN) {
        return ResponseEntity.ok(
                MarketDataResponse.from(marketDataService.fetchSectorFlowRanking(kind, period, topN)));
    }
}
