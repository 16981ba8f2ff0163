package com.fundfeed.provider.tushare;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration for the Tushare Pro HTTP API.
 *
 * <p>Reads from application.yml:
 * <pre>
 * fundfeed.tushare.token=${TUSHARE_TOKEN:}
 * fundfeed.tushare.url=http://api.tushare.pro
 * </pre>
 * Without a token the Tushare source is never registered.
 */
@Data
@Component
@ConfigurationProperties(prefix = "fundfeed.tushare")
public class TushareConfig {

    private String token;
    private String url = "http://api.tushare.pro";

    public boolean hasToken() {
        return token != null && !token.isBlank();
    }
}
