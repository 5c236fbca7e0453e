package com.retryguard.core.ratelimit;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 限流桶只读快照
 */
@Getter
@ToString
@AllArgsConstructor
public class BucketStatus {

    private final double tokens;

    private final int maxTokens;

    /** 是否至少有一个令牌 */
    private final boolean available;

    private final double refillRatePerSecond;
}
