package com.fundfeed.observability;

import com.fundfeed.domain.enums.CircuitState;
import com.fundfeed.event.FetchCompletedEvent;
import com.fundfeed.event.SourceHealthEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Registers and updates Micrometer metrics for the fetch layer.
 *
 * <ul>
 *   <li><b>fundfeed.fetch.count</b> (counter, tags dataType/outcome): one per pipeline call</li>
 *   <li><b>fundfeed.fetch.latency</b> (timer, tag dataType): wall time of a pipeline call</li>
 *   <li><b>fundfeed.source.failures</b> (counter, tag dataType): failed source attempts</li>
 *   <li><b>fundfeed.circuit.opened</b> (counter, tags dataType/source): breaker openings</li>
 * </ul>
 *
 * <p>Meters are resolved through the registry on each event; Micrometer returns the existing
 * meter for a known name and tag set.
 */
@Service
public class FetchMetricsService {

    private final MeterRegistry meterRegistry;

    public FetchMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @EventListener
    @Order(20)
    public void onFetchCompleted(FetchCompletedEvent event) {
        String dataType = event.getDataType().getKey();
        Counter.builder("fundfeed.fetch.count")
                .description("Pipeline calls by outcome")
                .tag("dataType", dataType)
                .tag("outcome", event.getOutcome().name())
                .register(meterRegistry)
                .increment();
        Timer.builder("fundfeed.fetch.latency")
                .description("Pipeline call latency including every source attempt")
                .tag("dataType", dataType)
                .publishPercentiles(0.5, 0.95, 0.99)
                .maximumExpectedValue(Duration.ofSeconds(60))
                .register(meterRegistry)
                .record(event.getElapsed());
        if (event.getFailedAttempts() > 0) {
            Counter.builder("fundfeed.source.failures")
                    .description("Failed or rejected source attempts")
                    .tag("dataType", dataType)
                    .register(meterRegistry)
                    .increment(event.getFailedAttempts());
        }
    }

    @EventListener
    @Order(20)
    public void onSourceHealth(SourceHealthEvent event) {
        if (event.getNewState() != CircuitState.OPEN) {
            return;
        }
        Counter.builder("fundfeed.circuit.opened")
                .description("Circuit breaker openings")
                .tag("dataType", event.getDataType().getKey())
                .tag("source", event.getSourceName())
                .register(meterRegistry)
                .increment();
    }
}
