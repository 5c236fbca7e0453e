package com.retryguard.model.enums;

/**
 * 错误严重程度（Recoverable 能力的一部分）
 */
public enum Severity {
    TRANSIENT,
    DEGRADED,
    CRITICAL,
    PERMANENT
}
