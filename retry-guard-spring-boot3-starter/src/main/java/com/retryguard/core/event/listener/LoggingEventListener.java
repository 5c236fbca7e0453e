package com.retryguard.core.event.listener;

import com.retryguard.core.event.StrategyEvent;
import com.retryguard.core.spi.StrategyEventListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 日志输出事件，默认启用
 */
public class LoggingEventListener implements StrategyEventListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingEventListener.class);

    @Override
    public String name() {
        return "log";
    }

    @Override
    public void onEvent(StrategyEvent event) {
        String type = event.getType().getEventName();
        switch (event.getType()) {
            case CIRCUIT_TRIP -> log.warn("[Event-{}] circuit={}, failures={}, err={}",
                    type, event.getSubject(), event.getFailureCount(), truncate(event.getError()));
            case CIRCUIT_RESET -> log.info("[Event-{}] circuit={}", type, event.getSubject());
            case CIRCUIT_STATE_CHANGE -> log.info("[Event-{}] circuit={}, {} -> {}",
                    type, event.getSubject(), event.getFrom(), event.getTo());
            default -> log.debug("[Event-{}] bucket={}, retryAfter={}ms",
                    type, event.getSubject(), event.getRetryAfterMs());
        }
    }

    private String truncate(Object err) {
        if (err == null) {
            return null;
        }
        String s = String.valueOf(err);
        return s.length() > 2000 ? s.substring(0, 2000) : s;
    }
}
