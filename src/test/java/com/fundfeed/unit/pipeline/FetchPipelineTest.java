package com.fundfeed.unit.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fundfeed.MutableClock;
import com.fundfeed.cache.InMemoryCacheStore;
import com.fundfeed.config.PipelineConfig;
import com.fundfeed.config.SourceConfig;
import com.fundfeed.domain.enums.DataType;
import com.fundfeed.domain.enums.FetchOutcome;
import com.fundfeed.domain.model.FetchRequest;
import com.fundfeed.domain.model.FetchResult;
import com.fundfeed.event.FetchCompletedEvent;
import com.fundfeed.exception.SchemaException;
import com.fundfeed.exception.TransientNetworkException;
import com.fundfeed.pipeline.FetchPipeline;
import com.fundfeed.provider.ProviderAdapter;
import com.fundfeed.source.SourceHealthSnapshot;
import com.fundfeed.source.SourceRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;
import java.util.function.Supplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Unit tests for FetchPipeline: cache precedence, source fallback, validation, stale serving,
 * breaker bookkeeping and in-flight coalescing.
 */
class FetchPipelineTest {

    private static final TypeReference<String> TEXT = new TypeReference<>() {};
    private static final Predicate<String> NON_BLANK = value -> !value.isBlank();
    private static final Duration TTL = Duration.ofSeconds(60);
    private static final Instant NOW = Instant.parse("2026-03-05T02:00:00Z");

    private InMemoryCacheStore cacheStore;
    private SourceConfig sourceConfig;
    private PipelineConfig pipelineConfig;
    private SourceRegistry sourceRegistry;
    private ApplicationEventPublisher applicationEventPublisher;
    private MutableClock clock;
    private FetchPipeline fetchPipeline;
    private StubAdapter primary;
    private StubAdapter secondary;

    @BeforeEach
    void setUp() {
        cacheStore = new InMemoryCacheStore(100);
        sourceConfig = new SourceConfig();
        pipelineConfig = new PipelineConfig();
        applicationEventPublisher = mock(ApplicationEventPublisher.class);
        sourceRegistry = new SourceRegistry(sourceConfig, applicationEventPublisher);
        clock = new MutableClock(NOW);
        fetchPipeline = new FetchPipeline(
                cacheStore, sourceRegistry, sourceConfig, pipelineConfig, applicationEventPublisher, clock);

        primary = new StubAdapter("primary");
        secondary = new StubAdapter("secondary");
        sourceRegistry.register(DataType.FUND_REALTIME, "primary", 100);
        sourceRegistry.register(DataType.FUND_REALTIME, "secondary", 50);
    }

    private static FetchRequest request(String code) {
        return FetchRequest.of(DataType.FUND_REALTIME, "code", code);
    }

    private FetchResult<String> fetch(FetchRequest request) {
        return fetchPipeline.fetch(request, List.of(primary, secondary), NON_BLANK, TTL, TEXT);
    }

    private SourceHealthSnapshot health(String name) {
        return sourceRegistry.snapshot().stream()
                .filter(s -> s.getName().equals(name))
                .findFirst()
                .orElseThrow();
    }

    private void seedExpired(FetchRequest request, String source, String value) {
        String envelope = "{\"source\":\"" + source + "\",\"fetchedAt\":\"2026-03-01T01:00:00Z\",\"value\":\""
                + value + "\"}";
        cacheStore.set(request.cacheKey(), envelope, TTL, NOW.minus(Duration.ofHours(2)));
    }

    @Nested
    @DisplayName("Resolution Order")
    class ResolutionOrder {

        @Test
        @DisplayName("Highest-priority source answers and its value is cached")
        void primaryAnswers() {
            primary.willReturn("1.2345");

            FetchResult<String> result = fetch(request("008888"));

            assertThat(result.getOutcome()).isEqualTo(FetchOutcome.SOURCE);
            assertThat(result.getValue()).isEqualTo("1.2345");
            assertThat(result.getSource()).isEqualTo("primary");
            assertThat(result.isStale()).isFalse();
            assertThat(secondary.calls()).isZero();
        }

        @Test
        @DisplayName("Fresh cache hit skips every source and keeps the original provenance")
        void freshCacheHit() {
            primary.willReturn("1.2345");
            FetchResult<String> first = fetch(request("008888"));

            FetchResult<String> second = fetch(request("008888"));

            assertThat(second.getOutcome()).isEqualTo(FetchOutcome.FRESH_CACHE);
            assertThat(second.getValue()).isEqualTo("1.2345");
            assertThat(second.getSource()).isEqualTo("primary");
            assertThat(second.getFetchedAt()).isEqualTo(first.getFetchedAt());
            assertThat(primary.calls()).isEqualTo(1);
        }

        @Test
        @DisplayName("Source value is stamped and cached at the clock's instant")
        void fetchedAtFromClock() {
            primary.willReturn("1.2345");

            FetchResult<String> result = fetch(request("008888"));

            assertThat(result.getFetchedAt()).isEqualTo(NOW);
            assertThat(cacheStore.get(request("008888").cacheKey(), NOW.plus(TTL))).isPresent();
            assertThat(cacheStore.get(request("008888").cacheKey(), NOW.plus(TTL).plusNanos(1))).isEmpty();
        }

        @Test
        @DisplayName("Cached value is fresh up to its TTL and goes upstream once past it")
        void ttlBoundary() {
            primary.willReturn("1.2345");
            primary.willReturn("1.3000");
            fetch(request("008888"));

            clock.advance(TTL);
            FetchResult<String> atExpiry = fetch(request("008888"));
            clock.advance(Duration.ofNanos(1));
            FetchResult<String> pastExpiry = fetch(request("008888"));

            assertThat(atExpiry.getOutcome()).isEqualTo(FetchOutcome.FRESH_CACHE);
            assertThat(pastExpiry.getOutcome()).isEqualTo(FetchOutcome.SOURCE);
            assertThat(pastExpiry.getValue()).isEqualTo("1.3000");
            assertThat(pastExpiry.getFetchedAt()).isEqualTo(NOW.plus(TTL).plusNanos(1));
            assertThat(primary.calls()).isEqualTo(2);
        }

        @Test
        @DisplayName("Failing source falls through to the next one and is charged a failure")
        void fallsBack() {
            primary.willThrow(new SchemaException("column renamed"));
            secondary.willReturn("1.2000");

            FetchResult<String> result = fetch(request("008888"));

            assertThat(result.getSource()).isEqualTo("secondary");
            assertThat(result.getValue()).isEqualTo("1.2000");
            assertThat(health("primary").getFailCount()).isEqualTo(1);
            assertThat(health("secondary").getFailCount()).isZero();
        }

        @Test
        @DisplayName("Unexpected runtime errors are contained like source failures")
        void unexpectedErrorContained() {
            primary.willThrow(new NullPointerException("boom"));
            secondary.willReturn("1.2000");

            FetchResult<String> result = fetch(request("008888"));

            assertThat(result.getSource()).isEqualTo("secondary");
            assertThat(health("primary").getFailCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Source success after earlier failures resets its counter")
        void successResets() {
            primary.willThrow(new TransientNetworkException("reset"));
            primary.willReturn("1.1");
            secondary.willReturn("1.0");
            fetch(request("000001"));

            fetch(request("000002"));

            assertThat(health("primary").getFailCount()).isZero();
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("Rejected value moves on to the next source without charging the breaker")
        void rejectedValueSkipped() {
            primary.willReturn("  ");
            secondary.willReturn("1.2000");

            FetchResult<String> result = fetch(request("008888"));

            assertThat(result.getSource()).isEqualTo("secondary");
            assertThat(health("primary").getFailCount()).isZero();
        }

        @Test
        @DisplayName("Rejected value charges the breaker when configured to")
        void rejectedValueCounted() {
            sourceConfig.getCircuitBreaker().setCountValidationFailures(true);
            primary.willReturn("  ");
            secondary.willReturn("1.2000");

            fetch(request("008888"));

            assertThat(health("primary").getFailCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Rejected value is never cached")
        void rejectedValueNotCached() {
            primary.willReturn("  ");
            secondary.willThrow(new SchemaException("bad"));

            fetch(request("008888"));

            assertThat(cacheStore.getAllowStale(request("008888").cacheKey())).isEmpty();
        }
    }

    @Nested
    @DisplayName("Fallbacks")
    class Fallbacks {

        @Test
        @DisplayName("All sources failing serves the expired cache entry flagged stale")
        void servesStale() {
            seedExpired(request("008888"), "primary", "1.1111");
            primary.willThrow(new TransientNetworkException("timeout"));
            secondary.willThrow(new TransientNetworkException("timeout"));

            FetchResult<String> result = fetch(request("008888"));

            assertThat(result.getOutcome()).isEqualTo(FetchOutcome.STALE_CACHE);
            assertThat(result.isStale()).isTrue();
            assertThat(result.getValue()).isEqualTo("1.1111");
            assertThat(result.getSource()).isEqualTo("primary");
            assertThat(result.getFetchedAt()).isEqualTo(Instant.parse("2026-03-01T01:00:00Z"));
        }

        @Test
        @DisplayName("Live source beats an expired cache entry")
        void sourceBeatsStale() {
            seedExpired(request("008888"), "primary", "1.1111");
            secondary.willReturn("1.3333");
            primary.willThrow(new TransientNetworkException("timeout"));

            FetchResult<String> result = fetch(request("008888"));

            assertThat(result.getOutcome()).isEqualTo(FetchOutcome.SOURCE);
            assertThat(result.getValue()).isEqualTo("1.3333");
        }

        @Test
        @DisplayName("Nothing cached and every source failing is an explicit no-data result")
        void noData() {
            primary.willThrow(new TransientNetworkException("timeout"));
            secondary.willThrow(new SchemaException("bad"));

            FetchResult<String> result = fetch(request("008888"));

            assertThat(result.getOutcome()).isEqualTo(FetchOutcome.NO_DATA);
            assertThat(result.isPresent()).isFalse();
            assertThat(result.getValue()).isNull();
            assertThat(result.getSource()).isNull();
        }

        @Test
        @DisplayName("Undecodable cache entry is treated as a miss")
        void undecodableEntryIgnored() {
            cacheStore.set(request("008888").cacheKey(), "not json at all", TTL, NOW);
            primary.willReturn("1.2345");

            FetchResult<String> result = fetch(request("008888"));

            assertThat(result.getOutcome()).isEqualTo(FetchOutcome.SOURCE);
            assertThat(result.getValue()).isEqualTo("1.2345");
        }

        @Test
        @DisplayName("No registered source for the data type still answers from cache or no-data")
        void noSourcesRegistered() {
            FetchRequest history = FetchRequest.of(DataType.FUND_HISTORY, "code", "008888");

            FetchResult<String> result =
                    fetchPipeline.fetch(history, List.of(primary, secondary), NON_BLANK, TTL, TEXT);

            assertThat(result.getOutcome()).isEqualTo(FetchOutcome.NO_DATA);
            assertThat(primary.calls()).isZero();
        }
    }

    @Nested
    @DisplayName("Circuit Breaker Integration")
    class CircuitBreakerIntegration {

        @Test
        @DisplayName("Source is skipped after three consecutive failures")
        void openSourceSkipped() {
            for (int i = 0; i < 4; i++) {
                primary.willThrow(new TransientNetworkException("down"));
                secondary.willReturn("1.0");
            }

            fetch(request("000001"));
            fetch(request("000002"));
            fetch(request("000003"));
            fetch(request("000004"));

            assertThat(primary.calls()).isEqualTo(3);
            assertThat(secondary.calls()).isEqualTo(4);
            assertThat(sourceRegistry.isAvailable(DataType.FUND_REALTIME, "primary")).isFalse();
        }

        @Test
        @DisplayName("Every call publishes a completion event with its outcome")
        void publishesCompletion() {
            primary.willThrow(new SchemaException("bad"));
            secondary.willReturn("1.0");

            fetch(request("008888"));

            ArgumentCaptor<FetchCompletedEvent> captor = ArgumentCaptor.forClass(FetchCompletedEvent.class);
            verify(applicationEventPublisher, atLeastOnce()).publishEvent(captor.capture());
            FetchCompletedEvent event = captor.getValue();
            assertThat(event.getOutcome()).isEqualTo(FetchOutcome.SOURCE);
            assertThat(event.getSourceName()).isEqualTo("secondary");
            assertThat(event.getFailedAttempts()).isEqualTo(1);
            assertThat(event.getDataType()).isEqualTo(DataType.FUND_REALTIME);
        }
    }

    @Nested
    @DisplayName("Coalescing")
    class Coalescing {

        @Test
        @DisplayName("Concurrent callers for the same key share one upstream call when enabled")
        void sharesInFlightCall() throws Exception {
            pipelineConfig.setCoalesceInFlight(true);
            CountDownLatch entered = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            primary.willAnswer(() -> {
                entered.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return "1.2345";
            });

            AtomicReference<FetchResult<String>> firstResult = new AtomicReference<>();
            AtomicReference<FetchResult<String>> secondResult = new AtomicReference<>();
            Thread first = new Thread(() -> firstResult.set(fetch(request("008888"))));
            first.start();
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

            Thread second = new Thread(() -> secondResult.set(fetch(request("008888"))));
            second.start();
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (second.getState() != Thread.State.WAITING && System.nanoTime() < deadline) {
                Thread.sleep(5);
            }
            release.countDown();
            first.join(5000);
            second.join(5000);

            assertThat(primary.calls()).isEqualTo(1);
            assertThat(firstResult.get().getValue()).isEqualTo("1.2345");
            assertThat(secondResult.get().getValue()).isEqualTo("1.2345");
        }
    }

    /** Adapter whose answers are queued per test; the last queued answer repeats. */
    private static final class StubAdapter implements ProviderAdapter<String> {

        private final String name;
        private final Deque<Supplier<String>> answers = new ArrayDeque<>();
        private final AtomicInteger calls = new AtomicInteger();

        StubAdapter(String name) {
            this.name = name;
        }

        void willReturn(String value) {
            answers.add(() -> value);
        }

        void willThrow(RuntimeException e) {
            answers.add(() -> {
                throw e;
            });
        }

        void willAnswer(Supplier<String> answer) {
            answers.add(answer);
        }

        int calls() {
            return calls.get();
        }

        @Override
        public String sourceName() {
            return name;
        }

        @Override
        public DataType dataType() {
            return DataType.FUND_REALTIME;
        }

        @Override
        public int defaultPriority() {
            return 0;
        }

        @Override
        public synchronized String fetch(FetchRequest request) {
            calls.incrementAndGet();
            Supplier<String> answer = answers.size() > 1 ? answers.poll() : answers.peek();
            if (answer == null) {
                throw new IllegalStateException("No answer queued for " + name);
            }
            return answer.get();
        }
    }
}
