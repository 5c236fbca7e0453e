package com.retryguard.core.spi;

import com.retryguard.core.ratelimit.BucketKey;
import com.retryguard.core.ratelimit.BucketStatus;
import com.retryguard.model.Admission;
import com.retryguard.model.JobDescriptor;
import com.retryguard.model.enums.RateLimitScope;

import java.util.Map;

/**
 * 令牌桶限流
 * <p>
 * 未配置的桶返回 NOT_CONFIGURED，调用方视为不限流
 */
public interface RateLimiter {

    /**
     * 取一个令牌
     * @param key GLOBAL 时忽略
     */
    Admission acquire(RateLimitScope scope, String key);

    /** 同 acquire，但不消耗令牌 */
    Admission check(RateLimitScope scope, String key);

    /** 按 worker -> queue -> global 依次取令牌，首个被限流的步骤中止 */
    Admission acquireForJob(JobDescriptor job);

    /** acquireForJob 的只读版本 */
    Admission checkForJob(JobDescriptor job);

    Map<BucketKey, BucketStatus> status();

    /** 补充所有桶 */
    void tick();

    default boolean isEnabled() {
        return true;
    }
}
