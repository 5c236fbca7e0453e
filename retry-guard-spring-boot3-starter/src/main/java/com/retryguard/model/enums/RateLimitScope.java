package com.retryguard.model.enums;

/**
 * 限流作用域
 */
public enum RateLimitScope {
    GLOBAL,
    QUEUE,
    WORKER
}
