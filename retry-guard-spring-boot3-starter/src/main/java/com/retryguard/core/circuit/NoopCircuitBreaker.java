package com.retryguard.core.circuit;

import com.retryguard.core.spi.CircuitBreaker;
import com.retryguard.model.Admission;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;

/**
 * 关闭熔断时使用：总是放行，不记录状态
 */
public class NoopCircuitBreaker implements CircuitBreaker {

    @Override
    public void register(String name, CircuitOptions options) {
    }

    @Override
    public Admission allow(String name) {
        return Admission.admitted();
    }

    @Override
    public void recordSuccess(String name) {
    }

    @Override
    public void recordFailure(String name, Object error) {
    }

    @Override
    public Optional<CircuitSnapshot> getState(String name) {
        return Optional.empty();
    }

    @Override
    public Map<String, CircuitSnapshot> getAllStates() {
        return Collections.emptyMap();
    }

    @Override
    public void reset(String name) {
    }

    @Override
    public void tick() {
    }

    @Override
    public boolean isEnabled() {
        return false;
    }
}
