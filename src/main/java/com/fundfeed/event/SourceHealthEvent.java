package com.fundfeed.event;

import com.fundfeed.domain.enums.CircuitState;
import com.fundfeed.domain.enums.DataType;
import java.time.Instant;
import org.springframework.context.ApplicationEvent;

/**
 * Published when a source's circuit breaker opens (failure threshold reached) or closes
 * again after a successful attempt.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>FetchMetricsService: counts breaker openings per source</li>
 * </ul>
 */
public class SourceHealthEvent extends ApplicationEvent {

    private final DataType dataType;
    private final String sourceName;
    private final CircuitState previousState;
    private final CircuitState newState;
    private final int failCount;
    private final Instant occurredAt;

    public SourceHealthEvent(
            Object source,
            DataType dataType,
            String sourceName,
            CircuitState previousState,
            CircuitState newState,
            int failCount,
            Instant occurredAt) {
        super(source);
        this.dataType = dataType;
        this.sourceName = sourceName;
        this.previousState = previousState;
        this.newState = newState;
        this.failCount = failCount;
        this.occurredAt = occurredAt;
    }

    public DataType getDataType() {
        return dataType;
    }

    public String getSourceName() {
        return sourceName;
    }

    public CircuitState getPreviousState() {
        return previousState;
    }

    public CircuitState getNewState() {
        return newState;
    }

    public int getFailCount() {
        return failCount;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }
}
