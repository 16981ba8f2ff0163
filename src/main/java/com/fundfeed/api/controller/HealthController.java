package com.fundfeed.api.controller;

import com.fundfeed.api.dto.response.SourceDiagnosticsResponse;
import com.fundfeed.config.SourceConfig;
import com.fundfeed.config.VendorHttpConfig;
import com.fundfeed.domain.enums.DataType;
import com.fundfeed.provider.tushare.TushareConfig;
import com.fundfeed.source.SourceRegistry;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Health check endpoints.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/health -- shallow health check, confirms the app responds</li>
 *   <li>GET /api/health/sources -- per-source breaker state and provider diagnostics</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/health")
public class HealthController {

    private final SourceRegistry sourceRegistry;
    private final SourceConfig sourceConfig;
    private final VendorHttpConfig vendorHttpConfig;
    private final TushareConfig tushareConfig;

    public HealthController(
            SourceRegistry sourceRegistry,
            SourceConfig sourceConfig,
            VendorHttpConfig vendorHttpConfig,
            TushareConfig tushareConfig) {
        this.sourceRegistry = sourceRegistry;
        this.sourceConfig = sourceConfig;
        this.vendorHttpConfig = vendorHttpConfig;
        this.tushareConfig = tushareConfig;
    }

    @GetMapping
    public ResponseEntity<Map<String, String>> shallowHealth() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }

    @GetMapping("/sources")
    public ResponseEntity<SourceDiagnosticsResponse> sources() {
        Map<String, String> modes = new LinkedHashMap<>();
        for (DataType dataType : DataType.values()) {
            modes.put(dataType.getKey(), sourceConfig.providerMode(dataType.getKey()));
        }
        SourceDiagnosticsResponse response = SourceDiagnosticsResponse.builder()
                .sources(sourceRegistry.snapshot())
                .providerModes(modes)
                .proxyEnvironment(VendorHttpConfig.presentProxyVariables(System.getenv()))
                .honorProxyEnv(vendorHttpConfig.isHonorProxyEnv())
                .tushareConfigured(tushareConfig.hasToken())
                .build();
        return ResponseEntity.ok(response);
    }
}
