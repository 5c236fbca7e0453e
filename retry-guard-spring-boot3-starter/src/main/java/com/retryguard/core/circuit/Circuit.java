package com.retryguard.core.circuit;

import com.retryguard.core.event.StrategyEvent;
import com.retryguard.model.enums.CircuitState;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.List;

/**
 * 单个熔断器的可变状态
 * <p>
 * 所有读写方法须在持有本对象监视器时调用；状态变更产生的事件写入 out，由调用方释放锁后发布
 */
@Slf4j
final class Circuit {

    private final String name;
    private final CircuitOptions options;

    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private int successCount;
    private int halfOpenCount;
    private Instant resetAt;
    private Object lastError;
    private Instant lastFailureAt;
    private long totalFailures;
    private long totalSuccesses;

    Circuit(String name, CircuitOptions options) {
        this.name = name;
        this.options = options;
    }

    /**
     * OPEN 且已到恢复时间 -> HALF_OPEN
     */
    void maybeHalfOpen(Instant now, List<StrategyEvent> out) {
        if (state == CircuitState.OPEN && resetAt != null && !now.isBefore(resetAt)) {
            resetAt = null;
            halfOpenCount = 0;
            transitionTo(CircuitState.HALF_OPEN, now, out);
        }
    }

    /**
     * @return 是否放行
     */
    boolean tryAcquire(Instant now, List<StrategyEvent> out) {
        maybeHalfOpen(now, out);
        switch (state) {
            case CLOSED:
                return true;
            case HALF_OPEN:
                if (halfOpenCount < options.getHalfOpenLimit()) {
                    halfOpenCount++;
                    return true;
                }
                return false;
            default:
                return false;
        }
    }

    void onSuccess(Instant now, List<StrategyEvent> out) {
        switch (state) {
            case CLOSED:
                totalSuccesses++;
                break;
            case HALF_OPEN:
                successCount++;
                totalSuccesses++;
                if (successCount >= options.getSuccessThreshold()) {
                    out.add(StrategyEvent.reset(name, now));
                    halfOpenCount = 0;
                    transitionTo(CircuitState.CLOSED, now, out);
                }
                break;
            default:
                // OPEN 期间忽略
                break;
        }
    }

    void onFailure(Object error, Instant now, List<StrategyEvent> out) {
        switch (state) {
            case CLOSED:
                failureCount++;
                totalFailures++;
                lastFailureAt = now;
                lastError = error;
                if (failureCount >= options.getFailureThreshold()) {
                    resetAt = now.plus(options.getResetTimeout());
                    out.add(StrategyEvent.trip(name, failureCount, error, now));
                    transitionTo(CircuitState.OPEN, now, out);
                }
                break;
            case HALF_OPEN:
                // 半开状态下任一失败立即重新打开
                totalFailures++;
                lastFailureAt = now;
                lastError = error;
                resetAt = now.plus(options.getResetTimeout());
                out.add(StrategyEvent.trip(name, options.getFailureThreshold(), error, now));
                transitionTo(CircuitState.OPEN, now, out);
                break;
            default:
                break;
        }
    }

    void forceReset(Instant now, List<StrategyEvent> out) {
        out.add(StrategyEvent.reset(name, now));
        resetAt = null;
        halfOpenCount = 0;
        transitionTo(CircuitState.CLOSED, now, out);
    }

    private void transitionTo(CircuitState next, Instant now, List<StrategyEvent> out) {
        CircuitState prev = state;
        log.info("[CircuitBreaker] {}: {} -> {} (failures: {}, successes: {})",
                name, prev, next, failureCount, successCount);
        out.add(StrategyEvent.stateChange(name, prev, next, now));
        state = next;
        failureCount = 0;
        successCount = 0;
    }

    CircuitSnapshot snapshot() {
        return CircuitSnapshot.builder()
                .name(name)
                .state(state)
                .failureCount(failureCount)
                .successCount(successCount)
                .failureThreshold(options.getFailureThreshold())
                .successThreshold(options.getSuccessThreshold())
                .halfOpenCount(halfOpenCount)
                .halfOpenLimit(options.getHalfOpenLimit())
                .totalFailures(totalFailures)
                .totalSuccesses(totalSuccesses)
                .lastFailureAt(lastFailureAt)
                .lastError(lastError)
                .resetAt(resetAt)
                .build();
    }
}
