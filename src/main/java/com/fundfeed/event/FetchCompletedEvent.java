package com.fundfeed.event;

import com.fundfeed.domain.enums.DataType;
import com.fundfeed.domain.enums.FetchOutcome;
import java.time.Duration;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the FetchPipeline once per call, whatever the outcome.
 *
 * <p>{@code sourceName} is null for NO_DATA. {@code failedAttempts} counts the sources that
 * were tried and failed before the call was answered.
 */
public class FetchCompletedEvent extends ApplicationEvent {

    private final DataType dataType;
    private final FetchOutcome outcome;
    private final String sourceName;
    private final int failedAttempts;
    private final Duration elapsed;

    public FetchCompletedEvent(
            Object source,
            DataType dataType,
            FetchOutcome outcome,
            String sourceName,
            int failedAttempts,
            Duration elapsed) {
        super(source);
        this.dataType = dataType;
        this.outcome = outcome;
        this.sourceName = sourceName;
        this.failedAttempts = failedAttempts;
        this.elapsed = elapsed;
    }

    public DataType getDataType() {
        return dataType;
    }

    public FetchOutcome getOutcome() {
        return outcome;
    }

    public String getSourceName() {
        return sourceName;
    }

    public int getFailedAttempts() {
        return failedAttempts;
    }

    public Duration getElapsed() {
        return elapsed;
    }
}
