package com.retryguard.model;

import com.retryguard.model.enums.BackoffShape;
import com.retryguard.model.enums.ErrorClass;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 错误分类结果，计算值，不落库
 */
@Getter
@Builder
@ToString
@EqualsAndHashCode
public final class Classification {

    private final ErrorClass errorClass;

    private final boolean retryable;

    /** 最大重试次数 */
    private final int maxRetries;

    private final BackoffShape strategy;

    private final long baseDelayMs;

    private final long maxDelayMs;

    /** 是否计入熔断失败 */
    private final boolean tripsCircuit;
}
