package com.retryguard.core.spi;

import com.retryguard.model.enums.BackoffShape;

/**
 * 回退策略（计算下一次重试延迟）
 */
public interface BackoffPolicy {

    /** 对应的回退形态，注册中心按此索引 */
    BackoffShape shape();

    /**
     * 计算延迟
     * @param attempt  第几次尝试
     * @param baseMs   基础延迟
     * @param maxMs    延迟上限
     * @return 延迟毫秒数，不小于 0
     */
    long delayMillis(int attempt, long baseMs, long maxMs);
}
