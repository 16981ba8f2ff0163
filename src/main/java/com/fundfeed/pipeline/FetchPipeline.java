package com.fundfeed.pipeline;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fundfeed.cache.CacheLookup;
import com.fundfeed.cache.CacheStore;
import com.fundfeed.config.PipelineConfig;
import com.fundfeed.config.SourceConfig;
import com.fundfeed.domain.enums.FailureKind;
import com.fundfeed.domain.model.FetchRequest;
import com.fundfeed.domain.model.FetchResult;
import com.fundfeed.event.FetchCompletedEvent;
import com.fundfeed.exception.SourceException;
import com.fundfeed.provider.ProviderAdapter;
import com.fundfeed.source.SourceRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Resolves a {@link FetchRequest} to the best available answer without ever throwing.
 *
 * <p>Order of resolution:
 * <ol>
 *   <li>an unexpired cache entry that passes the validator;</li>
 *   <li>each available source in descending priority: an exception records a breaker failure
 *       and moves on, a value the validator rejects moves on, the first accepted value records
 *       a success, is written to the cache and returned;</li>
 *   <li>the cached entry regardless of expiry, flagged stale;</li>
 *   <li>an explicit no-data result.</li>
 * </ol>
 *
 * <p>Vendor calls run on the calling thread and outside every lock; the cache and the
 * registry serialize their own state. Two concurrent misses for the same key both go
 * upstream and the last write wins, unless {@code fundfeed.pipeline.coalesce-in-flight}
 * makes the later caller wait for the earlier one's result.
 *
 * <p>Cache expiry and {@code fetchedAt} are read from the injected {@link Clock}.
 */
@Service
public class FetchPipeline {

    private static final Logger log = LoggerFactory.getLogger(FetchPipeline.class);

    private final CacheStore cacheStore;
    private final SourceRegistry sourceRegistry;
    private final SourceConfig sourceConfig;
    private final PipelineConfig pipelineConfig;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;
    private final ConcurrentHashMap<String, CompletableFuture<FetchResult<?>>> inFlight = new ConcurrentHashMap<>();

    public FetchPipeline(
            CacheStore cacheStore,
            SourceRegistry sourceRegistry,
            SourceConfig sourceConfig,
            PipelineConfig pipelineConfig,
            ApplicationEventPublisher applicationEventPublisher,
            Clock clock) {
        this.cacheStore = cacheStore;
        this.sourceRegistry = sourceRegistry;
        this.sourceConfig = sourceConfig;
        this.pipelineConfig = pipelineConfig;
        this.applicationEventPublisher = applicationEventPublisher;
        this.clock = clock;
    }

    @SuppressWarnings("unchecked")
    public <T> FetchResult<T> fetch(
            FetchRequest request,
            List<? extends ProviderAdapter<T>> adapters,
            Predicate<T> validator,
            Duration ttl,
            TypeReference<T> type) {
        if (!pipelineConfig.isCoalesceInFlight()) {
            return resolve(request, adapters, validator, ttl, type);
        }
        String key = request.cacheKey();
        CompletableFuture<FetchResult<?>> mine = new CompletableFuture<>();
        CompletableFuture<FetchResult<?>> running = inFlight.putIfAbsent(key, mine);
        if (running != null) {
            log.debug("Joining in-flight fetch for {}", key);
            return (FetchResult<T>) running.join();
        }
        try {
            FetchResult<T> result = resolve(request, adapters, validator, ttl, type);
            mine.complete(result);
            return result;
        } finally {
            if (!mine.isDone()) {
                mine.complete(FetchResult.noData());
            }
            inFlight.remove(key, mine);
        }
    }

    private <T> FetchResult<T> resolve(
            FetchRequest request,
            List<? extends ProviderAdapter<T>> adapters,
            Predicate<T> validator,
            Duration ttl,
            TypeReference<T> type) {
        long startNanos = System.nanoTime();
        String key = request.cacheKey();

        Optional<CachedPayload<T>> fresh = readFresh(key, type).filter(p -> passes(validator, p.getValue()));
        if (fresh.isPresent()) {
            log.debug("Cache hit for {} (source {})", key, fresh.get().getSource());
            CachedPayload<T> payload = fresh.get();
            return complete(
                    request, FetchResult.fresh(payload.getValue(), payload.getSource(), payload.getFetchedAt()), 0,
                    startNanos);
        }

        Map<String, ProviderAdapter<T>> byName = new LinkedHashMap<>();
        for (ProviderAdapter<T> adapter : adapters) {
            if (adapter.dataType() == request.getDataType()) {
                byName.putIfAbsent(adapter.sourceName(), adapter);
            }
        }

        int failures = 0;
        for (String sourceName : sourceRegistry.listAvailable(request.getDataType())) {
            ProviderAdapter<T> adapter = byName.get(sourceName);
            if (adapter == null) {
                continue;
            }
            T value;
            try {
                value = adapter.fetch(request);
            } catch (SourceException e) {
                failures++;
                sourceRegistry.recordFailure(request.getDataType(), sourceName);
                log.warn("Source {} failed for {} [{}]: {}", sourceName, key, e.getFailureKind(), e.getMessage());
                continue;
            } catch (RuntimeException e) {
                failures++;
                sourceRegistry.recordFailure(request.getDataType(), sourceName);
                log.warn("Source {} failed for {} [{}]", sourceName, key, FailureKind.UNEXPECTED, e);
                continue;
            }

            if (!passes(validator, value)) {
                failures++;
                if (sourceConfig.getCircuitBreaker().isCountValidationFailures()) {
                    sourceRegistry.recordFailure(request.getDataType(), sourceName);
                }
                log.warn("Source {} returned an unusable value for {} [{}]", sourceName, key, FailureKind.VALIDATION);
                continue;
            }

            sourceRegistry.recordSuccess(request.getDataType(), sourceName);
            Instant fetchedAt = clock.instant();
            writeCache(key, sourceName, fetchedAt, value, ttl);
            return complete(request, FetchResult.fromSource(value, sourceName, fetchedAt), failures, startNanos);
        }

        Optional<CachedPayload<T>> stale = readAllowStale(key, type).filter(p -> passes(validator, p.getValue()));
        if (stale.isPresent()) {
            CachedPayload<T> payload = stale.get();
            log.warn(
                    "All sources failed for {}, serving stale value from {} fetched at {}",
                    key,
                    payload.getSource(),
                    payload.getFetchedAt());
            return complete(
                    request, FetchResult.stale(payload.getValue(), payload.getSource(), payload.getFetchedAt()),
                    failures, startNanos);
        }

        log.warn("No data for {}: {} source attempts failed and nothing is cached", key, failures);
        return complete(request, FetchResult.noData(), failures, startNanos);
    }

    private <T> Optional<CachedPayload<T>> readFresh(String key, TypeReference<T> type) {
        try {
            return cacheStore.get(key, clock.instant()).flatMap(text -> decode(key, text, type));
        } catch (RuntimeException e) {
            log.error("Cache read failed for {}", key, e);
            return Optional.empty();
        }
    }

    private <T> Optional<CachedPayload<T>> readAllowStale(String key, TypeReference<T> type) {
        try {
            return cacheStore
                    .getAllowStale(key, clock.instant())
                    .map(CacheLookup::getValue)
                    .flatMap(text -> decode(key, text, type));
        } catch (RuntimeException e) {
            log.error("Stale cache read failed for {}", key, e);
            return Optional.empty();
        }
    }

    private <T> Optional<CachedPayload<T>> decode(String key, String text, TypeReference<T> type) {
        try {
            return Optional.of(CachedPayload.decode(text, type));
        } catch (RuntimeException e) {
            log.warn("Ignoring undecodable cache entry for {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private <T> void writeCache(String key, String sourceName, Instant fetchedAt, T value, Duration ttl) {
        try {
            cacheStore.set(key, CachedPayload.encode(sourceName, fetchedAt, value), ttl, fetchedAt);
        } catch (RuntimeException e) {
            log.error("Cache write failed for {}", key, e);
        }
    }

    private static <T> boolean passes(Predicate<T> validator, T value) {
        if (value == null) {
            return false;
        }
        try {
            return validator == null || validator.test(value);
        } catch (RuntimeException e) {
            log.debug("Validator threw on {}: {}", value.getClass().getSimpleName(), e.getMessage());
            return false;
        }
    }

    private <T> FetchResult<T> complete(FetchRequest request, FetchResult<T> result, int failures, long startNanos) {
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        try {
            applicationEventPublisher.publishEvent(new FetchCompletedEvent(
                    this, request.getDataType(), result.getOutcome(), result.getSource(), failures, elapsed));
        } catch (RuntimeException e) {
            log.error("FetchCompletedEvent listener failed for {}", request.cacheKey(), e);
        }
        return result;
    }
}
