package com.retryguard.core.spi;

import com.retryguard.model.enums.RecoveryStrategy;
import com.retryguard.model.enums.Severity;

/**
 * 错误自描述恢复能力
 * <p>
 * 实现该接口的错误优先走能力分类，不再匹配模式表；任一方法抛异常时回退到模式分类
 */
public interface Recoverable {

    /** 是否可恢复（可重试） */
    boolean isRecoverable();

    /** 恢复策略，可为 null */
    RecoveryStrategy strategy();

    /** 严重程度，可为 null */
    Severity severity();

    /** 最大尝试次数 */
    int maxAttempts();

    /** 是否计入熔断失败 */
    boolean tripsCircuit();
}
