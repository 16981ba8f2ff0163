package com.fundfeed.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import java.net.InetSocketAddress;
import java.net.Proxy;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.client.RestClient;

/**
 * Configuration properties and the {@link RestClient} used for every vendor call.
 *
 * <p>Binds to the {@code fundfeed.http.*} prefix. Vendor calls connect directly; ambient
 * proxy variables are only honored with {@code honor-proxy-env=true}.
 */
@Configuration
@ConfigurationProperties(prefix = "fundfeed.http")
@Getter
@Setter
@Validated
public class VendorHttpConfig {

    private static final Logger log = LoggerFactory.getLogger(VendorHttpConfig.class);

    static final List<String> PROXY_ENV_VARS = List.of("HTTPS_PROXY", "https_proxy", "HTTP_PROXY", "http_proxy");

    private Duration connectTimeout = Duration.ofSeconds(5);

    private Duration readTimeout = Duration.ofSeconds(20);

    private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
            + "(KHTML, like Gecko) Chrome/124.0 Safari/537.36";

    /** Route vendor calls through HTTPS_PROXY / HTTP_PROXY when set. */
    private boolean honorProxyEnv = false;

    @Valid
    private Retry retry = new Retry();

    @Bean
    public RestClient vendorRestClient() {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) connectTimeout.toMillis());
        requestFactory.setReadTimeout((int) readTimeout.toMillis());
        Proxy proxy = resolveProxy(honorProxyEnv, System.getenv());
        requestFactory.setProxy(proxy);
        log.info(
                "Vendor HTTP client: connect {}ms, read {}ms, proxy {}",
                connectTimeout.toMillis(),
                readTimeout.toMillis(),
                proxy == Proxy.NO_PROXY ? "bypassed" : proxy.address());
        return RestClient.builder()
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.USER_AGENT, userAgent)
                .defaultHeader(HttpHeaders.ACCEPT, "application/json, text/javascript, */*; q=0.01")
                .defaultHeader(HttpHeaders.ACCEPT_LANGUAGE, "zh-CN,zh;q=0.9")
                .build();
    }

    /**
     * Picks the proxy for vendor calls: {@link Proxy#NO_PROXY} unless honoring is enabled and
     * one of the proxy variables holds a usable {@code scheme://host:port} URL.
     */
    public static Proxy resolveProxy(boolean honorProxyEnv, Map<String, String> env) {
        if (!honorProxyEnv) {
            return Proxy.NO_PROXY;
        }
        for (String name : PROXY_ENV_VARS) {
            String value = env.get(name);
            if (value == null || value.isBlank()) {
                continue;
            }
            try {
                URI uri = URI.create(value.contains("://") ? value.trim() : "http://" + value.trim());
                if (uri.getHost() == null) {
                    log.warn("Ignoring {}: no host in '{}'", name, value);
                    continue;
                }
                int port = uri.getPort() > 0 ? uri.getPort() : 80;
                return new Proxy(Proxy.Type.HTTP, InetSocketAddress.createUnresolved(uri.getHost(), port));
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring {}: malformed proxy URL '{}'", name, value);
            }
        }
        return Proxy.NO_PROXY;
    }

    /** Names of proxy variables present in the environment, for diagnostics. */
    public static List<String> presentProxyVariables(Map<String, String> env) {
        List<String> present = new ArrayList<>();
        for (String name : PROXY_ENV_VARS) {
            String value = env.get(name);
            if (value != null && !value.isBlank()) {
                present.add(name);
            }
        }
        return present;
    }

    @Getter
    @Setter
    public static class Retry {

        /** Total attempts per vendor call, including the first. */
        @Min(1)
        private int maxAttempts = 3;

        /**
         * Wait before attempt n+1 is the n-th entry; the last entry repeats. Needs
         * {@code maxAttempts - 1} entries, later ones are never reached.
         */
        private List<Duration> backoff = new ArrayList<>(List.of(Duration.ofMillis(600), Duration.ofMillis(1400)));
    }
}
