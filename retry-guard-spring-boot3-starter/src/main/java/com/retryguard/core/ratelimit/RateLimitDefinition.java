package com.retryguard.core.ratelimit;

import com.retryguard.model.enums.RateLimitScope;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.util.Objects;

/**
 * 限流定义：每 period 最多 limit 次
 */
@Getter
@ToString
public final class RateLimitDefinition {

    private final BucketKey bucketKey;

    private final int limit;

    private final Duration period;

    private RateLimitDefinition(BucketKey bucketKey, int limit, Duration period) {
        this.bucketKey = Objects.requireNonNull(bucketKey, "bucketKey");
        if (limit <= 0) {
            throw new IllegalArgumentException("rate limit for " + bucketKey + " must be > 0");
        }
        if (period == null || period.toMillis() <= 0) {
            throw new IllegalArgumentException("rate limit period for " + bucketKey + " must be >= 1ms");
        }
        this.limit = limit;
        this.period = period;
    }

    public static RateLimitDefinition of(RateLimitScope scope, String key, int limit, Duration period) {
        return new RateLimitDefinition(BucketKey.of(scope, key), limit, period);
    }

    public static RateLimitDefinition global(int limit, Duration period) {
        return of(RateLimitScope.GLOBAL, null, limit, period);
    }

    public static RateLimitDefinition queue(String queue, int limit, Duration period) {
        return of(RateLimitScope.QUEUE, queue, limit, period);
    }

    public static RateLimitDefinition worker(String worker, int limit, Duration period) {
        return of(RateLimitScope.WORKER, worker, limit, period);
    }
}
