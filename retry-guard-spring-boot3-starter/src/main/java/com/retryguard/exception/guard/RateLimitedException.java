package com.retryguard.exception.guard;

import com.retryguard.core.spi.Recoverable;
import com.retryguard.model.enums.RecoveryStrategy;
import com.retryguard.model.enums.Severity;
import lombok.Getter;

/**
 * 限流拒绝，任务未执行；retryAfterMs 为建议的最早重试间隔
 */
@Getter
public class RateLimitedException extends RuntimeException implements Recoverable {

    private final String bucket;

    private final long retryAfterMs;

    public RateLimitedException(String bucket, long retryAfterMs) {
        super("rate limited: " + bucket + ", retry after " + retryAfterMs + "ms");
        this.bucket = bucket;
        this.retryAfterMs = retryAfterMs;
    }

    @Override
    public boolean isRecoverable() { return true; }

    @Override
    public RecoveryStrategy strategy() { return RecoveryStrategy.WAIT_UNTIL; }

    @Override
    public Severity severity() { return Severity.TRANSIENT; }

    @Override
    public int maxAttempts() { return Integer.MAX_VALUE; }

    @Override
    public boolean tripsCircuit() { return false; }
}
