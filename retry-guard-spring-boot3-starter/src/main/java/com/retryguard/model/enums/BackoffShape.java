package com.retryguard.model.enums;

/**
 * 退避形态
 */
public enum BackoffShape {
    /** 不等待 */
    NONE,

    /** 固定间隔 */
    FIXED,

    /** 指数退避 + 抖动 */
    EXPONENTIAL
}
