package com.fundfeed.source;

import com.fundfeed.config.SourceConfig;
import com.fundfeed.domain.enums.CircuitState;
import com.fundfeed.domain.enums.DataType;
import com.fundfeed.event.SourceHealthEvent;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Maps each data type to its named sources and tracks every source's circuit breaker.
 *
 * <p>Health is kept per (data type, source name), so a vendor registered for two data types
 * can be open for one and closed for the other. All state is guarded by a single lock; events
 * are published after the lock is released.
 *
 * <p>Transitions into OPEN are logged at WARN and transitions back to CLOSED at INFO, and both
 * publish a {@link SourceHealthEvent}.
 */
@Service
public class SourceRegistry {

    private static final Logger log = LoggerFactory.getLogger(SourceRegistry.class);

    private static final Comparator<SourceHealth> BY_PRIORITY = Comparator.comparingInt(SourceHealth::getPriority)
            .reversed()
            .thenComparingLong(SourceHealth::getRegistrationOrder);

    private final Map<DataType, Map<String, SourceHealth>> sources = new EnumMap<>(DataType.class);
    private final ReentrantLock lock = new ReentrantLock();
    private final SourceConfig sourceConfig;
    private final ApplicationEventPublisher applicationEventPublisher;
    private long registrations;

    public SourceRegistry(SourceConfig sourceConfig, ApplicationEventPublisher applicationEventPublisher) {
        this.sourceConfig = sourceConfig;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    /**
     * Registers a source for a data type. Registering an existing name again only updates its
     * priority; its breaker state is kept.
     */
    public void register(DataType dataType, String name, int priority) {
        lock.lock();
        try {
            Map<String, SourceHealth> byName = sources.computeIfAbsent(dataType, k -> new LinkedHashMap<>());
            SourceHealth existing = byName.get(name);
            if (existing != null) {
                existing.setPriority(priority);
            } else {
                byName.put(name, new SourceHealth(dataType, name, priority, registrations++));
            }
        } finally {
            lock.unlock();
        }
        log.info("Registered source {} for {} with priority {}", name, dataType.getKey(), priority);
    }

    public void recordSuccess(DataType dataType, String name) {
        recordSuccess(dataType, name, Instant.now());
    }

    /** Testable version: resets the failure counter, closing the breaker. */
    public void recordSuccess(DataType dataType, String name, Instant now) {
        CircuitState previous;
        int failCount;
        lock.lock();
        try {
            SourceHealth health = require(dataType, name);
            previous = health.state(now, threshold(), cooldown());
            failCount = health.getFailCount();
            health.recordSuccess();
        } finally {
            lock.unlock();
        }
        if (previous != CircuitState.CLOSED) {
            log.info(
                    "Source {} for {} recovered after {} consecutive failures", name, dataType.getKey(), failCount);
            publish(dataType, name, previous, CircuitState.CLOSED, 0, now);
        }
    }

    public void recordFailure(DataType dataType, String name) {
        recordFailure(dataType, name, Instant.now());
    }

    /** Testable version: increments the failure counter and stamps the failure time. */
    public void recordFailure(DataType dataType, String name, Instant now) {
        CircuitState previous;
        CircuitState current;
        int failCount;
        lock.lock();
        try {
            SourceHealth health = require(dataType, name);
            previous = health.state(now, threshold(), cooldown());
            health.recordFailure(now);
            current = health.state(now, threshold(), cooldown());
            failCount = health.getFailCount();
        } finally {
            lock.unlock();
        }
        if (current == CircuitState.OPEN && previous != CircuitState.OPEN) {
            log.warn(
                    "Circuit opened for source {} ({}) after {} failures, skipping it for {}",
                    name,
                    dataType.getKey(),
                    failCount,
                    cooldown());
            publish(dataType, name, previous, current, failCount, now);
        }
    }

    public boolean isAvailable(DataType dataType, String name) {
        return isAvailable(dataType, name, Instant.now());
    }

    /** Unknown sources are never available. */
    public boolean isAvailable(DataType dataType, String name, Instant now) {
        lock.lock();
        try {
            SourceHealth health = find(dataType, name);
            return health != null && health.isAvailable(now, threshold(), cooldown());
        } finally {
            lock.unlock();
        }
    }

    public List<String> listAvailable(DataType dataType) {
        return listAvailable(dataType, Instant.now());
    }

    /**
     * Testable version: names of the currently available sources for a data type, highest
     * priority first, ties in registration order.
     */
    public List<String> listAvailable(DataType dataType, Instant now) {
        lock.lock();
        try {
            Map<String, SourceHealth> byName = sources.get(dataType);
            if (byName == null) {
                return List.of();
            }
            return byName.values().stream()
                    .filter(health -> health.isAvailable(now, threshold(), cooldown()))
                    .sorted(BY_PRIORITY)
                    .map(SourceHealth::getName)
                    .collect(Collectors.toList());
        } finally {
            lock.unlock();
        }
    }

    public List<SourceHealthSnapshot> snapshot() {
        return snapshot(Instant.now());
    }

    /** Testable version: every registered source, grouped by data type, in priority order. */
    public List<SourceHealthSnapshot> snapshot(Instant now) {
        lock.lock();
        try {
            List<SourceHealthSnapshot> result = new ArrayList<>();
            for (Map<String, SourceHealth> byName : sources.values()) {
                byName.values().stream().sorted(BY_PRIORITY).forEach(health -> {
                    CircuitState state = health.state(now, threshold(), cooldown());
                    result.add(SourceHealthSnapshot.builder()
                            .dataType(health.getDataType())
                            .name(health.getName())
                            .priority(health.getPriority())
                            .failCount(health.getFailCount())
                            .lastFailAt(health.getLastFailAt())
                            .state(state)
                            .available(state != CircuitState.OPEN)
                            .build());
                });
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    private SourceHealth find(DataType dataType, String name) {
        Map<String, SourceHealth> byName = sources.get(dataType);
        return byName != null ? byName.get(name) : null;
    }

    private SourceHealth require(DataType dataType, String name) {
        SourceHealth health = find(dataType, name);
        if (health == null) {
            throw new IllegalArgumentException("Source " + name + " is not registered for " + dataType.getKey());
        }
        return health;
    }

    private int threshold() {
        return sourceConfig.getCircuitBreaker().getFailureThreshold();
    }

    private Duration cooldown() {
        return sourceConfig.getCircuitBreaker().getCooldown();
    }

    private void publish(
            DataType dataType, String name, CircuitState previous, CircuitState current, int failCount, Instant now) {
        applicationEventPublisher.publishEvent(
                new SourceHealthEvent(this, dataType, name, previous, current, failCount, now));
    }
}
