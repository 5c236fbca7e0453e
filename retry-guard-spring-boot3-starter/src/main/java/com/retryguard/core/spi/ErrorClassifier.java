package com.retryguard.core.spi;

import com.retryguard.model.Classification;
import com.retryguard.model.NextAction;
import com.retryguard.model.enums.ErrorClass;

/**
 * 错误分类器
 * <p>
 * 所有方法均为纯计算，不抛异常、不阻塞；任何错误值都有分类结果
 */
public interface ErrorClassifier {

    /** 分类 */
    Classification classify(Object error);

    /**
     * 计算第 attempt 次尝试后的重试延迟（毫秒）
     * @param attempt 从1开始
     */
    long retryDelay(Object error, int attempt);

    /**
     * 下一步动作：不可重试 DISCARD，次数耗尽 DEAD_LETTER，否则 RETRY
     */
    NextAction nextAction(Object error, int attempt);

    default ErrorClass errorClass(Object error) {
        return classify(error).getErrorClass();
    }

    default boolean isRetryable(Object error) {
        return classify(error).isRetryable();
    }

    default boolean isTerminal(Object error) {
        return classify(error).getErrorClass() == ErrorClass.TERMINAL;
    }

    default boolean tripsCircuit(Object error) {
        return classify(error).isTripsCircuit();
    }

    /** 已用尝试次数是否达到上限 */
    default boolean isExhausted(Object error, int attempt) {
        return attempt >= classify(error).getMaxRetries();
    }
}
