package com.retryguard.model.enums;

/**
 * 准入结果
 */
public enum AdmissionStatus {
    /** 放行 */
    ADMITTED,

    /** 未配置限制，调用方按无限制处理 */
    NOT_CONFIGURED,

    /** 被限流 */
    RATE_LIMITED,

    /** 熔断打开 */
    CIRCUIT_OPEN
}
