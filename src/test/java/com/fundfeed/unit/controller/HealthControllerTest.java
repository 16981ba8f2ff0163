package com.fundfeed.unit.controller;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fundfeed.api.controller.HealthController;
import com.fundfeed.config.ApiResponseAdvice;
import com.fundfeed.config.SourceConfig;
import com.fundfeed.config.VendorHttpConfig;
import com.fundfeed.domain.enums.DataType;
import com.fundfeed.provider.tushare.TushareConfig;
import com.fundfeed.source.SourceRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Standalone MockMvc tests for the HealthController.
 */
@ExtendWith(MockitoExtension.class)
class HealthControllerTest {

    private static final Instant SERVED_AT = Instant.parse("2026-03-05T07:00:00Z");

    private MockMvc mockMvc;

    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    private SourceRegistry sourceRegistry;

    @BeforeEach
    void setUp() {
        SourceConfig sourceConfig = new SourceConfig();
        sourceConfig.setProviders(Map.of("sector-flow", "eastmoney_push2"));
        sourceRegistry = new SourceRegistry(sourceConfig, applicationEventPublisher);

        TushareConfig tushareConfig = new TushareConfig();
        tushareConfig.setToken("  ");

        HealthController controller =
                new HealthController(sourceRegistry, sourceConfig, new VendorHttpConfig(), tushareConfig);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new ApiResponseAdvice(Clock.fixed(SERVED_AT, ZoneOffset.UTC)))
                .build();
    }

    @Test
    @DisplayName("GET /api/health returns 200 with status UP (shallow)")
    void shallowHealthReturns200() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("UP"))
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.timestamp").value("2026-03-05T07:00:00Z"));
    }

    @Test
    @DisplayName("GET /api/health/sources lists every source with its breaker state")
    void sourcesListed() throws Exception {
        sourceRegistry.register(DataType.FUND_REALTIME, "eastmoney_fundgz", 100);
        sourceRegistry.register(DataType.FUND_REALTIME, "eastmoney_lsjz_latest", 60);
        Instant now = Instant.now();
        for (int i = 0; i < 3; i++) {
            sourceRegistry.recordFailure(DataType.FUND_REALTIME, "eastmoney_fundgz", now);
        }

        mockMvc.perform(get("/api/health/sources"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.sources.length()").value(2))
                .andExpect(jsonPath("$.data.sources[?(@.name == 'eastmoney_fundgz')].state").value("OPEN"))
                .andExpect(jsonPath("$.data.sources[?(@.name == 'eastmoney_fundgz')].available").value(false))
                .andExpect(jsonPath("$.data.sources[?(@.name == 'eastmoney_lsjz_latest')].state").value("CLOSED"));
    }

    @Test
    @DisplayName("GET /api/health/sources reports provider modes and Tushare configuration")
    void providerDiagnostics() throws Exception {
        mockMvc.perform(get("/api/health/sources"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.providerModes.fund_realtime").value("auto"))
                .andExpect(jsonPath("$.data.providerModes.sector_flow").value("eastmoney_push2"))
                .andExpect(jsonPath("$.data.honorProxyEnv").value(false))
                .andExpect(jsonPath("$.data.tushareConfigured").value(false));
    }
}
