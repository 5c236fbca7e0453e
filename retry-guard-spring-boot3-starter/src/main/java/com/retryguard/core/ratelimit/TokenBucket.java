package com.retryguard.core.ratelimit;

/**
 * 令牌桶，读写须持有本对象监视器
 * <p>
 * 不变量：0 <= tokens <= maxTokens
 */
final class TokenBucket {

    private final int maxTokens;

    /** 每毫秒补充的令牌数 */
    private final double refillRate;

    private double tokens;

    private long lastRefill;

    TokenBucket(RateLimitDefinition def, long nowMs) {
        this.maxTokens = def.getLimit();
        this.refillRate = (double) def.getLimit() / def.getPeriod().toMillis();
        this.tokens = maxTokens;
        this.lastRefill = nowMs;
    }

    void refill(long nowMs) {
        long elapsed = Math.max(0L, nowMs - lastRefill);
        tokens = Math.min(maxTokens, tokens + elapsed * refillRate);
        lastRefill = nowMs;
    }

    /**
     * @return 0 表示取得令牌，否则为建议等待毫秒数
     */
    long tryAcquire(long nowMs) {
        refill(nowMs);
        if (tokens >= 1.0d) {
            tokens -= 1.0d;
            return 0L;
        }
        return retryAfter();
    }

    /** 不消耗令牌 */
    long peek(long nowMs) {
        refill(nowMs);
        return tokens >= 1.0d ? 0L : retryAfter();
    }

    private long retryAfter() {
        return Math.max(1L, (long) Math.ceil((1.0d - tokens) / refillRate));
    }

    BucketStatus status(long nowMs) {
        refill(nowMs);
        return new BucketStatus(tokens, maxTokens, tokens >= 1.0d, refillRate * 1000d);
    }

    double tokens() {
        return tokens;
    }
}
