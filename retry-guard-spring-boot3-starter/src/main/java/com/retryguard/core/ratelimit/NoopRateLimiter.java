package com.retryguard.core.ratelimit;

import com.retryguard.core.spi.RateLimiter;
import com.retryguard.model.Admission;
import com.retryguard.model.JobDescriptor;
import com.retryguard.model.enums.RateLimitScope;

import java.util.Collections;
import java.util.Map;

/**
 * 关闭限流时使用：总是放行
 */
public class NoopRateLimiter implements RateLimiter {

    @Override
    public Admission acquire(RateLimitScope scope, String key) {
        return Admission.admitted();
    }

    @Override
    public Admission check(RateLimitScope scope, String key) {
        return Admission.admitted();
    }

    @Override
    public Admission acquireForJob(JobDescriptor job) {
        return Admission.admitted();
    }

    @Override
    public Admission checkForJob(JobDescriptor job) {
        return Admission.admitted();
    }

    @Override
    public Map<BucketKey, BucketStatus> status() {
        return Collections.emptyMap();
    }

    @Override
    public void tick() {
    }

    @Override
    public boolean isEnabled() {
        return false;
    }
}
