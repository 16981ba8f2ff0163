package com.fundfeed.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Cache time-to-live per data type ({@code fundfeed.ttl.*}).
 */
@Configuration
@ConfigurationProperties(prefix = "fundfeed.ttl")
@Getter
@Setter
public class TtlConfig {

    private Duration fundRealtime = Duration.ofSeconds(60);

    private Duration fundHistory = Duration.ofSeconds(3600);

    private Duration sectorFlow = Duration.ofSeconds(60);
}
