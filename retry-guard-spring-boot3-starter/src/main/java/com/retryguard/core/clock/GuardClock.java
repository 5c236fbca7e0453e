package com.retryguard.core.clock;

import java.time.Instant;

/**
 * 时间源：单调时钟用于令牌补充，墙钟用于熔断恢复时间
 */
public interface GuardClock {

    GuardClock SYSTEM = new GuardClock() {
        @Override
        public long monotonicMillis() {
            return System.nanoTime() / 1_000_000L;
        }

        @Override
        public Instant now() {
            return Instant.now();
        }
    };

    long monotonicMillis();

    Instant now();
}
