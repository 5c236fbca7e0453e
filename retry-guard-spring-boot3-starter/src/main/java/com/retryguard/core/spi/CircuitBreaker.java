package com.retryguard.core.spi;

import com.retryguard.core.circuit.CircuitOptions;
import com.retryguard.core.circuit.CircuitSnapshot;
import com.retryguard.model.Admission;

import java.util.Map;
import java.util.Optional;

/**
 * 按名称隔离的三态熔断器
 * <p>
 * 未注册的名称一律放行，记录操作为空操作
 */
public interface CircuitBreaker {

    /** 创建或替换熔断器 */
    void register(String name, CircuitOptions options);

    /** 准入判定：ADMITTED 或 CIRCUIT_OPEN */
    Admission allow(String name);

    void recordSuccess(String name);

    void recordFailure(String name, Object error);

    Optional<CircuitSnapshot> getState(String name);

    Map<String, CircuitSnapshot> getAllStates();

    /** 强制回到 CLOSED */
    void reset(String name);

    /** 扫描所有 OPEN 熔断器，到期的转 HALF_OPEN */
    void tick();

    /** false 表示无操作实现 */
    default boolean isEnabled() {
        return true;
    }
}
