package com.retryguard.core.circuit;

import com.retryguard.core.clock.GuardClock;
import com.retryguard.core.event.StrategyEvent;
import com.retryguard.core.event.StrategyEventPublisher;
import com.retryguard.core.spi.CircuitBreaker;
import com.retryguard.model.Admission;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 默认三态熔断器
 * <p>
 * 每个熔断器自身加锁，互不阻塞；事件在释放锁后发布
 */
@Slf4j
public class DefaultCircuitBreaker implements CircuitBreaker {

    private final ConcurrentHashMap<String, Circuit> circuits = new ConcurrentHashMap<>(16);

    private final StrategyEventPublisher publisher;

    private final GuardClock clock;

    public DefaultCircuitBreaker(StrategyEventPublisher publisher, GuardClock clock) {
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public DefaultCircuitBreaker() {
        this(StrategyEventPublisher.NOOP, GuardClock.SYSTEM);
    }

    /**
     * 批量注册
     */
    public DefaultCircuitBreaker registerAll(Map<String, CircuitOptions> all) {
        all.forEach(this::register);
        return this;
    }

    @Override
    public void register(String name, CircuitOptions options) {
        Objects.requireNonNull(name, "name");
        circuits.put(name, new Circuit(name, options == null ? CircuitOptions.defaults() : options));
        log.debug("[CircuitBreaker] registered circuit={} options={}", name, options);
    }

    @Override
    public Admission allow(String name) {
        Circuit c = lookup(name);
        if (c == null) {
            // 未知熔断器默认放行
            return Admission.admitted();
        }
        List<StrategyEvent> events = new ArrayList<>(2);
        boolean permitted;
        synchronized (c) {
            permitted = c.tryAcquire(clock.now(), events);
        }
        publish(events);
        if (!permitted) {
            log.debug("[CircuitBreaker] rejected circuit={}", name);
            return Admission.circuitOpen(name);
        }
        return Admission.admitted();
    }

    @Override
    public void recordSuccess(String name) {
        Circuit c = lookup(name);
        if (c == null) {
            return;
        }
        List<StrategyEvent> events = new ArrayList<>(2);
        synchronized (c) {
            c.onSuccess(clock.now(), events);
        }
        publish(events);
    }

    @Override
    public void recordFailure(String name, Object error) {
        Circuit c = lookup(name);
        if (c == null) {
            return;
        }
        List<StrategyEvent> events = new ArrayList<>(2);
        synchronized (c) {
            c.onFailure(error, clock.now(), events);
        }
        publish(events);
    }

    @Override
    public Optional<CircuitSnapshot> getState(String name) {
        Circuit c = lookup(name);
        if (c == null) {
            return Optional.empty();
        }
        synchronized (c) {
            return Optional.of(c.snapshot());
        }
    }

    @Override
    public Map<String, CircuitSnapshot> getAllStates() {
        Map<String, CircuitSnapshot> out = new TreeMap<>();
        circuits.forEach((name, c) -> {
            synchronized (c) {
                out.put(name, c.snapshot());
            }
        });
        return Collections.unmodifiableMap(out);
    }

    @Override
    public void reset(String name) {
        Circuit c = lookup(name);
        if (c == null) {
            return;
        }
        List<StrategyEvent> events = new ArrayList<>(2);
        synchronized (c) {
            c.forceReset(clock.now(), events);
        }
        publish(events);
    }

    @Override
    public void tick() {
        Instant now = clock.now();
        for (Circuit c : circuits.values()) {
            List<StrategyEvent> events = new ArrayList<>(1);
            synchronized (c) {
                c.maybeHalfOpen(now, events);
            }
            publish(events);
        }
    }

    private Circuit lookup(String name) {
        return name == null ? null : circuits.get(name);
    }

    private void publish(List<StrategyEvent> events) {
        for (StrategyEvent e : events) {
            publisher.publish(e);
        }
    }
}
