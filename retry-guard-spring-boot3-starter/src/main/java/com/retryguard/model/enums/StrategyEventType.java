package com.retryguard.model.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 策略层对外发出的观测事件
 */
@AllArgsConstructor
@Getter
public enum StrategyEventType {
    CIRCUIT_STATE_CHANGE("circuit.state_change"),
    CIRCUIT_TRIP("circuit.trip"),
    CIRCUIT_RESET("circuit.reset"),
    RATE_LIMIT_EXCEEDED("rate_limit.exceeded")
    ;

    private final String eventName;
}
