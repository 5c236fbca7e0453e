package com.retryguard.core.circuit;

import com.retryguard.model.enums.CircuitState;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * 熔断器只读快照
 */
@Getter
@Builder
@ToString
public class CircuitSnapshot {

    private final String name;

    private final CircuitState state;

    private final int failureCount;

    private final int successCount;

    private final int failureThreshold;

    private final int successThreshold;

    private final int halfOpenCount;

    private final int halfOpenLimit;

    private final long totalFailures;

    private final long totalSuccesses;

    private final Instant lastFailureAt;

    private final Object lastError;

    /** 仅 OPEN 时非空 */
    private final Instant resetAt;
}
