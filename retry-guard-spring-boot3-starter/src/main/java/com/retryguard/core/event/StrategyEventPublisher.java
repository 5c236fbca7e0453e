package com.retryguard.core.event;

import com.retryguard.core.spi.StrategyEventListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 事件分发：监听器异常只记日志，不影响调用方
 */
@Slf4j
public class StrategyEventPublisher {

    /** 不分发任何事件 */
    public static final StrategyEventPublisher NOOP = new StrategyEventPublisher(null);

    private final List<StrategyEventListener> listeners = new CopyOnWriteArrayList<>();

    public StrategyEventPublisher(@Nullable List<StrategyEventListener> listeners) {
        if (listeners != null) {
            this.listeners.addAll(listeners);
        }
    }

    public void publish(StrategyEvent event) {
        for (StrategyEventListener l : listeners) {
            try {
                if (l.supports(event)) {
                    l.onEvent(event);
                }
            } catch (RuntimeException e) {
                log.warn("[Strategy-Event] listener {} failed on {} for {}",
                        l.name(), event.getType().getEventName(), event.getSubject(), e);
            }
        }
    }

    public List<StrategyEventListener> listeners() {
        return List.copyOf(listeners);
    }
}
