package com.fundfeed.provider;

import com.fundfeed.config.VendorHttpConfig;
import com.fundfeed.exception.TransientNetworkException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Bounded retry with a fixed backoff schedule for vendor calls.
 *
 * <p>Only {@link TransientNetworkException} is retried. Attempt n waits the n-th entry of
 * the backoff list before the next try; once the list is exhausted its last entry repeats.
 * When all attempts fail, the last exception propagates unchanged and the caller counts it as
 * one source failure.
 *
 * <p>One Resilience4j {@link Retry} instance is kept per source name so retry events are
 * attributed to the right vendor.
 */
@Component
public class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final RetryRegistry retryRegistry;

    public RetryPolicy(VendorHttpConfig vendorHttpConfig) {
        this(vendorHttpConfig.getRetry().getMaxAttempts(), vendorHttpConfig.getRetry().getBackoff());
    }

    public RetryPolicy(int maxAttempts, List<Duration> backoff) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        List<Duration> schedule = backoff == null || backoff.isEmpty() ? List.of(Duration.ZERO) : List.copyOf(backoff);
        if (schedule.size() > maxAttempts - 1 && maxAttempts > 1) {
            log.warn(
                    "Backoff {} has more than {} entries for {} attempts; extra entries are unused",
                    schedule,
                    maxAttempts - 1,
                    maxAttempts);
            schedule = schedule.subList(0, maxAttempts - 1);
        }
        RetryConfig retryConfig = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(backoffSchedule(schedule))
                .retryOnException(TransientNetworkException.class::isInstance)
                .build();
        this.retryRegistry = RetryRegistry.of(retryConfig);
        this.retryRegistry.getEventPublisher().onEntryAdded(added -> added.getAddedEntry()
                .getEventPublisher()
                .onRetry(event -> log.warn(
                        "Retrying {} (attempt {} failed, waiting {}ms): {}",
                        event.getName(),
                        event.getNumberOfRetryAttempts(),
                        event.getWaitInterval().toMillis(),
                        event.getLastThrowable() != null
                                ? event.getLastThrowable().getMessage()
                                : "unknown")));
    }

    public <R> R execute(String sourceName, Supplier<R> call) {
        Retry retry = retryRegistry.retry(sourceName);
        return retry.executeSupplier(call);
    }

    static IntervalFunction backoffSchedule(List<Duration> schedule) {
        return attempt -> schedule.get(Math.min(Math.max(attempt, 1), schedule.size()) - 1).toMillis();
    }
}
