package com.fundfeed.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import java.time.Duration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for source registration and circuit breaking.
 *
 * <p>Binds to {@code fundfeed.sources.*}:
 * <ul>
 *   <li>{@code circuit-breaker.failure-threshold} / {@code cooldown}: breaker tuning</li>
 *   <li>{@code providers.<data-type>}: {@code auto} or the name of the only source to use</li>
 *   <li>{@code priorities.<source-name>}: override of an adapter's default priority</li>
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "fundfeed.sources")
@Getter
@Setter
@Validated
public class SourceConfig {

    public static final String AUTO = "auto";

    @Valid
    private CircuitBreaker circuitBreaker = new CircuitBreaker();

    private Map<String, String> providers = new HashMap<>();

    private Map<String, Integer> priorities = new HashMap<>();

    /** Provider mode for a data type key, {@code auto} when not configured. */
    public String providerMode(String dataTypeKey) {
        String mode = lookup(providers, dataTypeKey);
        return mode == null || mode.isBlank() ? AUTO : mode.trim();
    }

    public Integer priorityOverride(String sourceName) {
        return lookup(priorities, sourceName);
    }

    /**
     * Map keys go through relaxed binding, which strips underscores from unbracketed keys,
     * so keys are compared with separators removed.
     */
    private static <V> V lookup(Map<String, V> map, String key) {
        String wanted = canonical(key);
        for (Map.Entry<String, V> entry : map.entrySet()) {
            if (canonical(entry.getKey()).equals(wanted)) {
                return entry.getValue();
            }
        }
        return null;
    }

    private static String canonical(String key) {
        return key.toLowerCase(Locale.ROOT).replace("_", "").replace("-", "").replace(".", "");
    }

    @Getter
    @Setter
    public static class CircuitBreaker {

        /** Consecutive failures after which a source is skipped. */
        @Min(1)
        private int failureThreshold = 3;

        /** How long an open source is skipped before one trial attempt is allowed. */
        private Duration cooldown = Duration.ofSeconds(300);

        /** Whether a validator rejection counts as a breaker failure. */
        private boolean countValidationFailures = false;
    }
}
