package com.retryguard.core.metric;

import com.retryguard.model.enums.CircuitState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 策略层计数器，按熔断器 / 限流桶打 tag
 */
public final class GuardMetrics {

    public static final String CIRCUIT_TRIP = "retry.guard.circuit.trip";
    public static final String CIRCUIT_RESET = "retry.guard.circuit.reset";
    public static final String CIRCUIT_STATE_CHANGE = "retry.guard.circuit.state_change";
    public static final String RATE_LIMIT_EXCEEDED = "retry.guard.rate_limit.exceeded";

    private final MeterRegistry reg;

    private GuardMetrics(MeterRegistry reg) {
        this.reg = reg;
    }

    /**
     * 汇总应用注册表：组合注册表内始终带一个 Simple，计数在没有外部后端时也可读；
     * commonTags 挂在组合注册表上，随计数器一起写入每个子注册表
     */
    public static GuardMetrics over(List<MeterRegistry> registries, Map<String, String> commonTags) {
        CompositeMeterRegistry composite = new CompositeMeterRegistry();
        if (commonTags != null && !commonTags.isEmpty()) {
            composite.config().commonTags(commonTags.entrySet().stream()
                    .map(e -> Tag.of(e.getKey(), e.getValue()))
                    .collect(Collectors.toList()));
        }
        composite.add(new SimpleMeterRegistry());
        if (registries != null) {
            registries.forEach(composite::add);
        }
        return new GuardMetrics(composite);
    }

    public void incTrip(String circuit) {
        Counter.builder(CIRCUIT_TRIP).description("circuit opened")
                .tag("circuit", circuit).register(reg).increment();
    }

    public void incReset(String circuit) {
        Counter.builder(CIRCUIT_RESET).description("circuit closed")
                .tag("circuit", circuit).register(reg).increment();
    }

    public void incStateChange(String circuit, CircuitState from, CircuitState to) {
        Counter.builder(CIRCUIT_STATE_CHANGE).description("circuit state transitions")
                .tag("circuit", circuit)
                .tag("from", String.valueOf(from))
                .tag("to", String.valueOf(to))
                .register(reg).increment();
    }

    public void incRateLimited(String bucket) {
        Counter.builder(RATE_LIMIT_EXCEEDED).description("rate limit rejections")
                .tag("bucket", bucket).register(reg).increment();
    }

    public MeterRegistry registry() { return reg; }
}
