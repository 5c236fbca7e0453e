package com.retryguard.core.backoff;

import com.retryguard.core.spi.BackoffPolicy;
import com.retryguard.model.enums.BackoffShape;

import java.util.concurrent.ThreadLocalRandom;

/**
 * base * 2^(attempt-1)，叠加最多 10% 的正向抖动，再截断到 max
 */
public class ExponentialJitterBackoffPolicy implements BackoffPolicy {

    private static final double JITTER_RATIO = 0.1d;

    @Override
    public BackoffShape shape() {
        return BackoffShape.EXPONENTIAL;
    }

    @Override
    public long delayMillis(int attempt, long baseMs, long maxMs) {
        // 0 -> base / 2, 1 -> base, 2 -> base * 2 ...
        double pow = Math.pow(2.0, attempt - 1);
        double ideal = Math.min((double) Long.MAX_VALUE, baseMs * pow);

        double jitter = ThreadLocalRandom.current().nextDouble() * ideal * JITTER_RATIO;
        long delay = Math.round(Math.min((double) Long.MAX_VALUE, ideal + jitter));
        return Math.max(0L, Math.min(delay, maxMs));
    }
}
