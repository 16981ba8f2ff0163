package com.fundfeed.api.dto.response;

import com.fundfeed.source.SourceHealthSnapshot;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Provider diagnostics returned by GET /api/health/sources.
 *
 * <p>Lists every registered source with its breaker state, the configured provider mode per
 * data type, and which proxy variables are present in the environment (names only) together
 * with whether vendor calls honor them.
 */
@Getter
@Builder
public class SourceDiagnosticsResponse {

    private final List<SourceHealthSnapshot> sources;

    /** Data type key to provider mode ({@code auto} or a source name). */
    private final Map<String, String> providerModes;

    private final List<String> proxyEnvironment;

    private final boolean honorProxyEnv;

    private final boolean tushareConfigured;
}
