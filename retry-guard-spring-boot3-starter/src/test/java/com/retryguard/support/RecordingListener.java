package com.retryguard.support;

import com.retryguard.core.event.StrategyEvent;
import com.retryguard.core.spi.StrategyEventListener;
import com.retryguard.model.enums.StrategyEventType;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

public class RecordingListener implements StrategyEventListener {

    private final List<StrategyEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void onEvent(StrategyEvent event) {
        events.add(event);
    }

    public List<StrategyEvent> events() {
        return events;
    }

    public List<StrategyEvent> ofType(StrategyEventType type) {
        return events.stream().filter(e -> e.getType() == type).collect(Collectors.toList());
    }

    public void clear() {
        events.clear();
    }
}
