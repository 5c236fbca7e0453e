package com.retryguard.core.backoff;

import com.retryguard.core.spi.BackoffPolicy;
import com.retryguard.model.enums.BackoffShape;

public class NoBackoffPolicy implements BackoffPolicy {

    @Override
    public BackoffShape shape() {
        return BackoffShape.NONE;
    }

    @Override
    public long delayMillis(int attempt, long baseMs, long maxMs) {
        return 0L;
    }
}
