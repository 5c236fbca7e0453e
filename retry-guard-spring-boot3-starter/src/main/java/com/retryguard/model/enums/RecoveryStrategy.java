package com.retryguard.model.enums;

/**
 * 错误自身声明的恢复策略
 */
public enum RecoveryStrategy {
    /** 直接重试 */
    RETRY,

    /** 指数退避重试 */
    RETRY_WITH_BACKOFF,

    /** 等待到某个时间点后重试 */
    WAIT_UNTIL,

    /** 交给熔断器处理 */
    CIRCUIT_BREAK,

    /** 快速失败 */
    FAIL_FAST,

    /** 走降级值 */
    FALLBACK
}
