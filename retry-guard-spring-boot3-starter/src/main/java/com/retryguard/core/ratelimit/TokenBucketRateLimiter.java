package com.retryguard.core.ratelimit;

import com.retryguard.core.clock.GuardClock;
import com.retryguard.core.event.StrategyEvent;
import com.retryguard.core.event.StrategyEventPublisher;
import com.retryguard.core.spi.RateLimiter;
import com.retryguard.model.Admission;
import com.retryguard.model.JobDescriptor;
import com.retryguard.model.enums.RateLimitScope;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 令牌桶限流
 * <p>
 * 桶在构造时按配置创建，之后只变更令牌数；每个桶自身加锁
 */
@Slf4j
public class TokenBucketRateLimiter implements RateLimiter {

    private final Map<BucketKey, TokenBucket> buckets = new ConcurrentHashMap<>(16);

    private final StrategyEventPublisher publisher;

    private final GuardClock clock;

    public TokenBucketRateLimiter(List<RateLimitDefinition> definitions,
                                  StrategyEventPublisher publisher,
                                  GuardClock clock) {
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.clock = Objects.requireNonNull(clock, "clock");
        long now = clock.monotonicMillis();
        for (RateLimitDefinition def : definitions) {
            if (buckets.put(def.getBucketKey(), new TokenBucket(def, now)) != null) {
                throw new IllegalArgumentException("duplicate rate limit for " + def.getBucketKey());
            }
        }
        log.debug("[RateLimiter] initialized with {} bucket(s)", buckets.size());
    }

    public TokenBucketRateLimiter(List<RateLimitDefinition> definitions) {
        this(definitions, StrategyEventPublisher.NOOP, GuardClock.SYSTEM);
    }

    @Override
    public Admission acquire(RateLimitScope scope, String key) {
        BucketKey bk = keyOf(scope, key);
        TokenBucket b = bk == null ? null : buckets.get(bk);
        if (b == null) {
            return Admission.notConfigured();
        }
        long retryAfter;
        synchronized (b) {
            retryAfter = b.tryAcquire(clock.monotonicMillis());
        }
        if (retryAfter == 0L) {
            return Admission.admitted();
        }
        log.debug("[RateLimiter] bucket={} limited, retryAfter={}ms", bk, retryAfter);
        publisher.publish(StrategyEvent.rateLimitExceeded(bk.toString(), retryAfter, clock.now()));
        return Admission.rateLimited(bk.toString(), retryAfter);
    }

    @Override
    public Admission check(RateLimitScope scope, String key) {
        BucketKey bk = keyOf(scope, key);
        TokenBucket b = bk == null ? null : buckets.get(bk);
        if (b == null) {
            return Admission.notConfigured();
        }
        long retryAfter;
        synchronized (b) {
            retryAfter = b.peek(clock.monotonicMillis());
        }
        return retryAfter == 0L ? Admission.admitted() : Admission.rateLimited(bk.toString(), retryAfter);
    }

    @Override
    public Admission acquireForJob(JobDescriptor job) {
        // worker -> queue -> global，已取得的令牌不退还
        if (job.hasWorker()) {
            Admission a = acquire(RateLimitScope.WORKER, job.getWorker());
            if (a.isRateLimited()) {
                return a;
            }
        }
        Admission a = acquire(RateLimitScope.QUEUE, job.queueOrDefault());
        if (a.isRateLimited()) {
            return a;
        }
        a = acquire(RateLimitScope.GLOBAL, null);
        if (a.isRateLimited()) {
            return a;
        }
        return Admission.admitted();
    }

    @Override
    public Admission checkForJob(JobDescriptor job) {
        if (job.hasWorker()) {
            Admission a = check(RateLimitScope.WORKER, job.getWorker());
            if (a.isRateLimited()) {
                return a;
            }
        }
        Admission a = check(RateLimitScope.QUEUE, job.queueOrDefault());
        if (a.isRateLimited()) {
            return a;
        }
        a = check(RateLimitScope.GLOBAL, null);
        if (a.isRateLimited()) {
            return a;
        }
        return Admission.admitted();
    }

    @Override
    public Map<BucketKey, BucketStatus> status() {
        long now = clock.monotonicMillis();
        Map<BucketKey, BucketStatus> out = new LinkedHashMap<>();
        buckets.forEach((k, b) -> {
            synchronized (b) {
                out.put(k, b.status(now));
            }
        });
        return Collections.unmodifiableMap(out);
    }

    @Override
    public void tick() {
        long now = clock.monotonicMillis();
        for (TokenBucket b : buckets.values()) {
            synchronized (b) {
                b.refill(now);
            }
        }
    }

    /** 当前令牌数（补充后），未配置返回 -1 */
    public double tokens(BucketKey key) {
        TokenBucket b = buckets.get(key);
        if (b == null) {
            return -1d;
        }
        synchronized (b) {
            b.refill(clock.monotonicMillis());
            return b.tokens();
        }
    }

    private static BucketKey keyOf(RateLimitScope scope, String key) {
        if (scope == RateLimitScope.GLOBAL) {
            return BucketKey.GLOBAL;
        }
        if (scope == null || key == null || key.isBlank()) {
            return null;
        }
        return BucketKey.of(scope, key);
    }
}
