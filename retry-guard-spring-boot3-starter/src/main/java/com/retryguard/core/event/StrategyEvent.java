package com.retryguard.core.event;

import com.retryguard.model.enums.CircuitState;
import com.retryguard.model.enums.StrategyEventType;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * 策略事件
 * <ul>
 *     <li>circuit.state_change: subject / from / to</li>
 *     <li>circuit.trip: subject / failureCount / error</li>
 *     <li>circuit.reset: subject</li>
 *     <li>rate_limit.exceeded: subject(bucket) / retryAfterMs</li>
 * </ul>
 */
@Getter
@Builder
@ToString
public class StrategyEvent {

    private final StrategyEventType type;

    /** 熔断器名或限流桶名 */
    private final String subject;

    private final CircuitState from;

    private final CircuitState to;

    private final int failureCount;

    private final Object error;

    private final long retryAfterMs;

    private final Instant when;

    public static StrategyEvent stateChange(String circuit, CircuitState from, CircuitState to, Instant when) {
        return StrategyEvent.builder().type(StrategyEventType.CIRCUIT_STATE_CHANGE)
                .subject(circuit).from(from).to(to).when(when).build();
    }

    public static StrategyEvent trip(String circuit, int failureCount, Object error, Instant when) {
        return StrategyEvent.builder().type(StrategyEventType.CIRCUIT_TRIP)
                .subject(circuit).failureCount(failureCount).error(error).when(when).build();
    }

    public static StrategyEvent reset(String circuit, Instant when) {
        return StrategyEvent.builder().type(StrategyEventType.CIRCUIT_RESET)
                .subject(circuit).when(when).build();
    }

    public static StrategyEvent rateLimitExceeded(String bucket, long retryAfterMs, Instant when) {
        return StrategyEvent.builder().type(StrategyEventType.RATE_LIMIT_EXCEEDED)
                .subject(bucket).retryAfterMs(retryAfterMs).when(when).build();
    }
}
