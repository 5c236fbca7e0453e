package com.retryguard.core.classify;

import com.retryguard.model.enums.BackoffShape;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 按错误类别配置的回退参数
 */
@Getter
@ToString
@EqualsAndHashCode
public final class BackoffSpec {

    public static final long DEFAULT_BASE_MS = 1_000L;
    public static final long DEFAULT_MAX_MS = 60_000L;

    /** 类别未配置回退时使用 */
    public static final BackoffSpec FALLBACK = exponential(DEFAULT_BASE_MS, DEFAULT_MAX_MS);

    private final BackoffShape shape;

    private final long baseMs;

    private final long maxMs;

    private BackoffSpec(BackoffShape shape, long baseMs, long maxMs) {
        if (baseMs < 0 || maxMs < 0) {
            throw new IllegalArgumentException("backoff delays must be >= 0");
        }
        if (maxMs < baseMs) {
            throw new IllegalArgumentException("backoff max must be >= base");
        }
        this.shape = shape;
        this.baseMs = baseMs;
        this.maxMs = maxMs;
    }

    public static BackoffSpec fixed(long delayMs) {
        return new BackoffSpec(BackoffShape.FIXED, delayMs, delayMs);
    }

    public static BackoffSpec exponential(long baseMs, long maxMs) {
        return new BackoffSpec(BackoffShape.EXPONENTIAL, baseMs, maxMs);
    }

    public static BackoffSpec none() {
        return new BackoffSpec(BackoffShape.NONE, 0L, 0L);
    }
}
