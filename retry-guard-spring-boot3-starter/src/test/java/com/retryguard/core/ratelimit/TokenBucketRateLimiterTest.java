package com.retryguard.core.ratelimit;

import com.retryguard.core.event.StrategyEvent;
import com.retryguard.core.event.StrategyEventPublisher;
import com.retryguard.model.Admission;
import com.retryguard.model.JobDescriptor;
import com.retryguard.model.enums.AdmissionStatus;
import com.retryguard.model.enums.RateLimitScope;
import com.retryguard.model.enums.StrategyEventType;
import com.retryguard.support.ManualGuardClock;
import com.retryguard.support.RecordingListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("TokenBucketRateLimiter")
class TokenBucketRateLimiterTest {

    private ManualGuardClock clock;
    private RecordingListener listener;

    @BeforeEach
    void setUp() {
        clock = new ManualGuardClock();
        listener = new RecordingListener();
    }

    private TokenBucketRateLimiter limiter(RateLimitDefinition... defs) {
        return new TokenBucketRateLimiter(List.of(defs), new StrategyEventPublisher(List.of(listener)), clock);
    }

    @Nested
    @DisplayName("Single bucket")
    class SingleBucketTests {

        @Test
        @DisplayName("five immediate acquires pass and the sixth is limited")
        void enforcesRate() {
            TokenBucketRateLimiter rl = limiter(RateLimitDefinition.global(5, Duration.ofMillis(1000)));

            for (int i = 0; i < 5; i++) {
                assertEquals(AdmissionStatus.ADMITTED, rl.acquire(RateLimitScope.GLOBAL, null).getStatus(),
                        "acquire " + (i + 1));
            }
            Admission sixth = rl.acquire(RateLimitScope.GLOBAL, null);

            assertEquals(AdmissionStatus.RATE_LIMITED, sixth.getStatus());
            assertTrue(sixth.getRetryAfterMs() > 0 && sixth.getRetryAfterMs() <= 200, "retryAfter " + sixth.getRetryAfterMs());
            assertEquals("global", sixth.getSource());

            StrategyEvent event = listener.ofType(StrategyEventType.RATE_LIMIT_EXCEEDED).get(0);
            assertEquals("global", event.getSubject());
            assertEquals(sixth.getRetryAfterMs(), event.getRetryAfterMs());
        }

        @Test
        @DisplayName("each successful acquire removes exactly one token")
        void consumesOne() {
            TokenBucketRateLimiter rl = limiter(RateLimitDefinition.queue("api", 10, Duration.ofMinutes(1)));

            rl.acquire(RateLimitScope.QUEUE, "api");
            rl.acquire(RateLimitScope.QUEUE, "api");

            assertEquals(8.0d, rl.tokens(BucketKey.queue("api")), 1e-9);
        }

        @Test
        @DisplayName("refills fully after an idle period and never exceeds the limit")
        void refillCapped() {
            TokenBucketRateLimiter rl = limiter(RateLimitDefinition.global(5, Duration.ofMillis(1000)));
            for (int i = 0; i < 5; i++) {
                rl.acquire(RateLimitScope.GLOBAL, null);
            }

            clock.advance(Duration.ofSeconds(10));

            assertTrue(rl.acquire(RateLimitScope.GLOBAL, null).isPermitted());
            assertEquals(4.0d, rl.tokens(BucketKey.GLOBAL), 1e-9);
        }

        @Test
        @DisplayName("partial refill admits one more after its share of the period")
        void partialRefill() {
            TokenBucketRateLimiter rl = limiter(RateLimitDefinition.global(5, Duration.ofMillis(1000)));
            for (int i = 0; i < 5; i++) {
                rl.acquire(RateLimitScope.GLOBAL, null);
            }

            clock.advanceMillis(190);
            assertFalse(rl.acquire(RateLimitScope.GLOBAL, null).isPermitted());
            clock.advanceMillis(20);
            assertTrue(rl.acquire(RateLimitScope.GLOBAL, null).isPermitted());
        }

        @Test
        @DisplayName("check does not consume")
        void checkIsReadOnly() {
            TokenBucketRateLimiter rl = limiter(RateLimitDefinition.global(1, Duration.ofSeconds(1)));

            assertTrue(rl.check(RateLimitScope.GLOBAL, null).isPermitted());
            assertTrue(rl.check(RateLimitScope.GLOBAL, null).isPermitted());
            assertTrue(rl.acquire(RateLimitScope.GLOBAL, null).isPermitted());
            assertEquals(AdmissionStatus.RATE_LIMITED, rl.check(RateLimitScope.GLOBAL, null).getStatus());
            assertTrue(listener.events().isEmpty());
        }

        @Test
        @DisplayName("unconfigured buckets report not configured")
        void notConfigured() {
            TokenBucketRateLimiter rl = limiter();

            assertEquals(AdmissionStatus.NOT_CONFIGURED, rl.acquire(RateLimitScope.QUEUE, "api").getStatus());
            assertEquals(AdmissionStatus.NOT_CONFIGURED, rl.check(RateLimitScope.GLOBAL, null).getStatus());
            assertTrue(rl.acquire(RateLimitScope.WORKER, "x").isPermitted());
        }

        @Test
        @DisplayName("duplicate and invalid definitions are rejected")
        void invalidDefinitions() {
            assertThrows(IllegalArgumentException.class,
                    () -> limiter(RateLimitDefinition.global(1, Duration.ofSeconds(1)),
                            RateLimitDefinition.global(2, Duration.ofSeconds(1))));
            assertThrows(IllegalArgumentException.class, () -> RateLimitDefinition.global(0, Duration.ofSeconds(1)));
            assertThrows(IllegalArgumentException.class, () -> RateLimitDefinition.global(1, Duration.ZERO));
            assertThrows(IllegalArgumentException.class, () -> RateLimitDefinition.queue(" ", 1, Duration.ofSeconds(1)));
        }
    }

    @Nested
    @DisplayName("Job chain")
    class JobChainTests {

        @Test
        @DisplayName("worker limit is checked before queue and global")
        void workerFirst() {
            TokenBucketRateLimiter rl = limiter(
                    RateLimitDefinition.worker("com.acme.Expensive", 1, Duration.ofHours(1)),
                    RateLimitDefinition.queue("default", 10, Duration.ofMinutes(1)),
                    RateLimitDefinition.global(10, Duration.ofMinutes(1)));
            JobDescriptor job = JobDescriptor.of("com.acme.Expensive", null);

            assertTrue(rl.acquireForJob(job).isPermitted());
            Admission second = rl.acquireForJob(job);

            assertEquals(AdmissionStatus.RATE_LIMITED, second.getStatus());
            assertEquals("worker:com.acme.Expensive", second.getSource());
            assertEquals(9.0d, rl.tokens(BucketKey.queue("default")), 1e-9);
            assertEquals(9.0d, rl.tokens(BucketKey.GLOBAL), 1e-9);
        }

        @Test
        @DisplayName("tokens taken by earlier steps are not refunded")
        void noRefund() {
            TokenBucketRateLimiter rl = limiter(
                    RateLimitDefinition.queue("api", 10, Duration.ofMinutes(1)),
                    RateLimitDefinition.global(1, Duration.ofMinutes(1)));
            JobDescriptor job = JobDescriptor.builder().queue("api").build();

            assertTrue(rl.acquireForJob(job).isPermitted());
            Admission limited = rl.acquireForJob(job);

            assertEquals("global", limited.getSource());
            assertEquals(8.0d, rl.tokens(BucketKey.queue("api")), 1e-9);
        }

        @Test
        @DisplayName("a job without worker skips the worker step and uses the default queue")
        void defaultsApplied() {
            TokenBucketRateLimiter rl = limiter(RateLimitDefinition.queue("default", 1, Duration.ofMinutes(1)));
            JobDescriptor job = JobDescriptor.builder().build();

            assertTrue(rl.acquireForJob(job).isPermitted());
            assertEquals("queue:default", rl.acquireForJob(job).getSource());
        }

        @Test
        @DisplayName("checkForJob walks the chain without consuming")
        void checkForJob() {
            TokenBucketRateLimiter rl = limiter(RateLimitDefinition.queue("api", 1, Duration.ofMinutes(1)));
            JobDescriptor job = JobDescriptor.of(null, "api");

            assertTrue(rl.checkForJob(job).isPermitted());
            assertTrue(rl.checkForJob(job).isPermitted());
            assertEquals(1.0d, rl.tokens(BucketKey.queue("api")), 1e-9);
        }
    }

    @Nested
    @DisplayName("Status and tick")
    class StatusTests {

        @Test
        @DisplayName("status reports every bucket without consuming")
        void status() {
            TokenBucketRateLimiter rl = limiter(
                    RateLimitDefinition.global(2, Duration.ofSeconds(1)),
                    RateLimitDefinition.queue("api", 60, Duration.ofMinutes(1)));
            rl.acquire(RateLimitScope.GLOBAL, null);
            rl.acquire(RateLimitScope.GLOBAL, null);

            Map<BucketKey, BucketStatus> status = rl.status();

            BucketStatus global = status.get(BucketKey.GLOBAL);
            assertEquals(0.0d, global.getTokens(), 1e-9);
            assertEquals(2, global.getMaxTokens());
            assertFalse(global.isAvailable());
            assertEquals(2.0d, global.getRefillRatePerSecond(), 1e-9);
            assertEquals(1.0d, status.get(BucketKey.queue("api")).getRefillRatePerSecond(), 1e-9);
        }

        @Test
        @DisplayName("tick refills without consuming and stays within bounds")
        void tick() {
            TokenBucketRateLimiter rl = limiter(RateLimitDefinition.global(4, Duration.ofSeconds(4)));
            for (int i = 0; i < 4; i++) {
                rl.acquire(RateLimitScope.GLOBAL, null);
            }
            clock.advance(Duration.ofSeconds(2));
            rl.tick();
            rl.tick();

            assertEquals(2.0d, rl.tokens(BucketKey.GLOBAL), 1e-9);
            clock.advance(Duration.ofHours(1));
            rl.tick();
            assertEquals(4.0d, rl.tokens(BucketKey.GLOBAL), 1e-9);
        }
    }

    @Test
    @DisplayName("concurrent acquires never admit more than the limit")
    void concurrentAcquires() throws InterruptedException {
        TokenBucketRateLimiter rl = limiter(RateLimitDefinition.global(100, Duration.ofHours(1)));
        int threads = 8;
        AtomicInteger admitted = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch done = new CountDownLatch(threads);
        for (int t = 0; t < threads; t++) {
            pool.submit(() -> {
                try {
                    for (int i = 0; i < 50; i++) {
                        if (rl.acquire(RateLimitScope.GLOBAL, null).isPermitted()) {
                            admitted.incrementAndGet();
                        }
                    }
                } finally {
                    done.countDown();
                }
            });
        }
        assertTrue(done.await(10, TimeUnit.SECONDS));
        pool.shutdown();

        assertEquals(100, admitted.get());
        assertEquals(0.0d, rl.tokens(BucketKey.GLOBAL), 1e-9);
    }

    @Test
    @DisplayName("no-op limiter always admits")
    void noop() {
        NoopRateLimiter noop = new NoopRateLimiter();

        assertTrue(noop.acquireForJob(JobDescriptor.of("w", "q")).isPermitted());
        assertTrue(noop.status().isEmpty());
        assertFalse(noop.isEnabled());
    }
}
