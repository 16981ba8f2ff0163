package com.fundfeed.source;

import com.fundfeed.domain.enums.CircuitState;
import com.fundfeed.domain.enums.DataType;
import java.time.Duration;
import java.time.Instant;

/**
 * Circuit breaker state of one source registered under one data type.
 *
 * <p>A source is available while {@code failCount < threshold}, or once
 * {@code now - lastFailAt > cooldown}. The cooldown does not reset the counter: the attempt
 * made after it elapses decides, a success resets the counter and a failure re-arms the
 * cooldown from the new failure time.
 *
 * <p>Not thread-safe on its own; {@link SourceRegistry} guards every instance with its lock.
 */
public class SourceHealth {

    private final DataType dataType;
    private final String name;
    private final long registrationOrder;
    private int priority;
    private int failCount;
    private Instant lastFailAt;

    SourceHealth(DataType dataType, String name, int priority, long registrationOrder) {
        this.dataType = dataType;
        this.name = name;
        this.priority = priority;
        this.registrationOrder = registrationOrder;
    }

    public CircuitState state(Instant now, int threshold, Duration cooldown) {
        if (failCount < threshold) {
            return CircuitState.CLOSED;
        }
        if (lastFailAt != null && Duration.between(lastFailAt, now).compareTo(cooldown) > 0) {
            return CircuitState.HALF_OPEN;
        }
        return CircuitState.OPEN;
    }

    public boolean isAvailable(Instant now, int threshold, Duration cooldown) {
        return state(now, threshold, cooldown) != CircuitState.OPEN;
    }

    void recordSuccess() {
        failCount = 0;
    }

    void recordFailure(Instant now) {
        failCount++;
        lastFailAt = now;
    }

    void setPriority(int priority) {
        this.priority = priority;
    }

    public DataType getDataType() {
        return dataType;
    }

    public String getName() {
        return name;
    }

    public int getPriority() {
        return priority;
    }

    public int getFailCount() {
        return failCount;
    }

    public Instant getLastFailAt() {
        return lastFailAt;
    }

    long getRegistrationOrder() {
        return registrationOrder;
    }
}
