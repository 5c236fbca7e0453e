package com.retryguard.core.event.listener;

import com.retryguard.core.event.StrategyEvent;
import com.retryguard.core.metric.GuardMetrics;
import com.retryguard.core.spi.StrategyEventListener;

import java.util.Objects;

/**
 * 事件计数
 */
public class MetricsEventListener implements StrategyEventListener {

    private final GuardMetrics metrics;

    public MetricsEventListener(GuardMetrics metrics) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @Override
    public String name() {
        return "metrics";
    }

    @Override
    public void onEvent(StrategyEvent event) {
        switch (event.getType()) {
            case CIRCUIT_TRIP -> metrics.incTrip(event.getSubject());
            case CIRCUIT_RESET -> metrics.incReset(event.getSubject());
            case CIRCUIT_STATE_CHANGE -> metrics.incStateChange(event.getSubject(), event.getFrom(), event.getTo());
            case RATE_LIMIT_EXCEEDED -> metrics.incRateLimited(event.getSubject());
        }
    }
}
