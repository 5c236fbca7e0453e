package com.retryguard.core.ratelimit;

import com.retryguard.model.enums.RateLimitScope;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Objects;

/**
 * 限流桶标识：global / queue:{name} / worker:{identity}
 */
@Getter
@EqualsAndHashCode
public final class BucketKey {

    public static final BucketKey GLOBAL = new BucketKey(RateLimitScope.GLOBAL, null);

    private final RateLimitScope scope;

    /** GLOBAL 时为 null */
    private final String key;

    private BucketKey(RateLimitScope scope, String key) {
        this.scope = scope;
        this.key = key;
    }

    public static BucketKey of(RateLimitScope scope, String key) {
        Objects.requireNonNull(scope, "scope");
        if (scope == RateLimitScope.GLOBAL) {
            return GLOBAL;
        }
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException(scope + " bucket requires a key");
        }
        return new BucketKey(scope, key);
    }

    public static BucketKey queue(String queue) {
        return of(RateLimitScope.QUEUE, queue);
    }

    public static BucketKey worker(String worker) {
        return of(RateLimitScope.WORKER, worker);
    }

    @Override
    public String toString() {
        return scope == RateLimitScope.GLOBAL ? "global" : scope.name().toLowerCase(java.util.Locale.ROOT) + ":" + key;
    }
}
