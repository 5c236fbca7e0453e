package com.retryguard.exception.guard;

import com.retryguard.core.spi.Recoverable;
import com.retryguard.model.enums.RecoveryStrategy;
import com.retryguard.model.enums.Severity;
import lombok.Getter;

/**
 * 熔断器打开，任务未执行
 */
@Getter
public class CircuitOpenException extends RuntimeException implements Recoverable {

    private final String circuit;

    public CircuitOpenException(String circuit) {
        super("circuit open: " + circuit);
        this.circuit = circuit;
    }

    @Override
    public boolean isRecoverable() { return true; }

    @Override
    public RecoveryStrategy strategy() { return RecoveryStrategy.WAIT_UNTIL; }

    @Override
    public Severity severity() { return Severity.DEGRADED; }

    @Override
    public int maxAttempts() { return Integer.MAX_VALUE; }

    @Override
    public boolean tripsCircuit() { return false; }
}
