package com.retryguard.core.circuit;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * 单个熔断器参数
 */
@Getter
@ToString
@EqualsAndHashCode
public final class CircuitOptions {

    public static final int DEFAULT_FAILURE_THRESHOLD = 5;
    public static final int DEFAULT_SUCCESS_THRESHOLD = 2;
    public static final Duration DEFAULT_RESET_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_HALF_OPEN_LIMIT = 3;

    private static final CircuitOptions DEFAULTS = builder().build();

    /** CLOSED 下连续失败达到该值打开 */
    private final int failureThreshold;

    /** HALF_OPEN 下成功达到该值关闭 */
    private final int successThreshold;

    /** OPEN 持续多久后进入 HALF_OPEN */
    private final Duration resetTimeout;

    /** HALF_OPEN 下最多放行的探测数 */
    private final int halfOpenLimit;

    private CircuitOptions(Builder b) {
        if (b.failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be > 0");
        }
        if (b.successThreshold <= 0) {
            throw new IllegalArgumentException("successThreshold must be > 0");
        }
        if (b.resetTimeout == null || b.resetTimeout.isNegative()) {
            throw new IllegalArgumentException("resetTimeout must be >= 0");
        }
        if (b.halfOpenLimit <= 0) {
            throw new IllegalArgumentException("halfOpenLimit must be > 0");
        }
        this.failureThreshold = b.failureThreshold;
        this.successThreshold = b.successThreshold;
        this.resetTimeout = b.resetTimeout;
        this.halfOpenLimit = b.halfOpenLimit;
    }

    public static CircuitOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** 以当前参数为基础继续覆盖 */
    public Builder toBuilder() {
        return new Builder()
                .failureThreshold(failureThreshold)
                .successThreshold(successThreshold)
                .resetTimeout(resetTimeout)
                .halfOpenLimit(halfOpenLimit);
    }

    public static final class Builder {
        private int failureThreshold = DEFAULT_FAILURE_THRESHOLD;
        private int successThreshold = DEFAULT_SUCCESS_THRESHOLD;
        private Duration resetTimeout = DEFAULT_RESET_TIMEOUT;
        private int halfOpenLimit = DEFAULT_HALF_OPEN_LIMIT;

        private Builder() {
        }

        public Builder failureThreshold(int v) { this.failureThreshold = v; return this; }

        public Builder successThreshold(int v) { this.successThreshold = v; return this; }

        public Builder resetTimeout(Duration v) { this.resetTimeout = v; return this; }

        public Builder halfOpenLimit(int v) { this.halfOpenLimit = v; return this; }

        public CircuitOptions build() {
            return new CircuitOptions(this);
        }
    }
}
