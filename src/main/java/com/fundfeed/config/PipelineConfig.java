package com.fundfeed.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the fetch pipeline ({@code fundfeed.pipeline.*}).
 */
@Configuration
@ConfigurationProperties(prefix = "fundfeed.pipeline")
@Getter
@Setter
public class PipelineConfig {

    /** Let concurrent callers for the same cache key share one upstream attempt. */
    private boolean coalesceInFlight = false;
}
