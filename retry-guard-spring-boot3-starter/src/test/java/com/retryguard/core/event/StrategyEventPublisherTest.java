package com.retryguard.core.event;

import com.retryguard.core.spi.StrategyEventListener;
import com.retryguard.model.enums.StrategyEventType;
import com.retryguard.support.RecordingListener;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("StrategyEventPublisher")
class StrategyEventPublisherTest {

    @Test
    @DisplayName("a failing listener does not stop delivery to the others")
    void isolatesListenerFailures() {
        StrategyEventListener broken = event -> {
            throw new IllegalStateException("listener down");
        };
        RecordingListener recording = new RecordingListener();
        StrategyEventPublisher publisher = new StrategyEventPublisher(List.of(broken, recording));

        assertDoesNotThrow(() -> publisher.publish(StrategyEvent.reset("api", Instant.now())));

        assertEquals(1, recording.events().size());
        assertEquals(StrategyEventType.CIRCUIT_RESET, recording.events().get(0).getType());
    }

    @Test
    @DisplayName("listeners only receive events they support")
    void honoursSupports() {
        RecordingListener onlyTrips = new RecordingListener() {
            @Override
            public boolean supports(StrategyEvent event) {
                return event.getType() == StrategyEventType.CIRCUIT_TRIP;
            }
        };
        StrategyEventPublisher publisher = new StrategyEventPublisher(List.of(onlyTrips));

        publisher.publish(StrategyEvent.rateLimitExceeded("global", 10L, Instant.now()));
        publisher.publish(StrategyEvent.trip("api", 5, "timeout", Instant.now()));

        assertEquals(1, onlyTrips.events().size());
    }
}
