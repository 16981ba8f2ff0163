package com.fundfeed.source;

import com.fundfeed.config.SourceConfig;
import com.fundfeed.domain.enums.DataType;
import com.fundfeed.provider.ProviderAdapter;
import com.fundfeed.provider.ProviderCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Registers provider adapters with the {@link SourceRegistry} once the application is up.
 *
 * <p>An adapter that reports {@code isConfigured() == false} (missing credential) is skipped
 * with a warning and is never listed. Per data type, provider mode {@code auto} registers
 * every configured adapter; any other mode registers only the adapter of that name.
 */
@Component
public class SourceRegistrar {

    private static final Logger log = LoggerFactory.getLogger(SourceRegistrar.class);

    private final SourceRegistry sourceRegistry;
    private final ProviderCatalog providerCatalog;
    private final SourceConfig sourceConfig;

    public SourceRegistrar(SourceRegistry sourceRegistry, ProviderCatalog providerCatalog, SourceConfig sourceConfig) {
        this.sourceRegistry = sourceRegistry;
        this.providerCatalog = providerCatalog;
        this.sourceConfig = sourceConfig;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        int registered = registerAll();
        log.info("Source registration complete: {} sources registered", registered);
    }

    /** Registers every eligible adapter and returns how many were registered. */
    public int registerAll() {
        int registered = 0;
        for (DataType dataType : DataType.values()) {
            String mode = sourceConfig.providerMode(dataType.getKey());
            boolean matched = false;
            for (ProviderAdapter<?> adapter : providerCatalog.forDataType(dataType)) {
                if (!SourceConfig.AUTO.equalsIgnoreCase(mode) && !mode.equalsIgnoreCase(adapter.sourceName())) {
                    log.debug("Skipping {} for {}: provider mode is {}", adapter.sourceName(), dataType.getKey(), mode);
                    continue;
                }
                matched = true;
                if (!adapter.isConfigured()) {
                    log.warn(
                            "Source {} for {} is not configured (missing credential), not registering it",
                            adapter.sourceName(),
                            dataType.getKey());
                    continue;
                }
                Integer override = sourceConfig.priorityOverride(adapter.sourceName());
                sourceRegistry.register(
                        dataType, adapter.sourceName(), override != null ? override : adapter.defaultPriority());
                registered++;
            }
            if (!matched && !SourceConfig.AUTO.equalsIgnoreCase(mode)) {
                log.warn(
                        "Provider mode '{}' for {} names no known source; it will be served from cache only",
                        mode,
                        dataType.getKey());
            }
        }
        return registered;
    }
}
