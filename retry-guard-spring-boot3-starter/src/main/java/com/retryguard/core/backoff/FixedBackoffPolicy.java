package com.retryguard.core.backoff;

import com.retryguard.core.spi.BackoffPolicy;
import com.retryguard.model.enums.BackoffShape;

public class FixedBackoffPolicy implements BackoffPolicy {

    @Override
    public BackoffShape shape() {
        return BackoffShape.FIXED;
    }

    @Override
    public long delayMillis(int attempt, long baseMs, long maxMs) {
        return Math.max(0L, baseMs);
    }
}
