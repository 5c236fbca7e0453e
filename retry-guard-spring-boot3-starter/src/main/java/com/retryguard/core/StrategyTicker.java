package com.retryguard.core;

import com.retryguard.core.spi.CircuitBreaker;
import com.retryguard.core.spi.RateLimiter;
import io.netty.util.Timeout;
import io.netty.util.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 周期维护：到期的 OPEN 熔断器转 HALF_OPEN，补充所有令牌桶
 * <p>
 * 基于时间轮自重排；单次 tick 失败只记录日志，不影响下一次
 */
public class StrategyTicker implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(StrategyTicker.class);

    private final Timer timer;

    private final CircuitBreaker circuitBreaker;

    private final RateLimiter rateLimiter;

    private final Duration interval;

    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile Timeout pending;

    public StrategyTicker(Timer timer, CircuitBreaker circuitBreaker, RateLimiter rateLimiter, Duration interval) {
        this.timer = timer;
        this.circuitBreaker = circuitBreaker;
        this.rateLimiter = rateLimiter;
        this.interval = interval == null ? Duration.ZERO : interval;
    }

    @Override
    public void start() {
        if (interval.isZero() || interval.isNegative()) {
            log.info("[Strategy-Ticker] start skipped, tick disabled");
            return;
        }
        if (!running.compareAndSet(false, true)) {
            return;
        }
        schedule();
        log.info("[Strategy-Ticker] started: interval={} ms, circuitBreaker={}, rateLimiter={}",
                interval.toMillis(), circuitBreaker.isEnabled(), rateLimiter.isEnabled());
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        Timeout t = pending;
        if (t != null) {
            t.cancel();
        }
        log.info("[Strategy-Ticker] stopped");
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    /**
     * 执行一次维护
     */
    public void tickOnce() {
        try {
            circuitBreaker.tick();
        } catch (RuntimeException e) {
            log.error("[Strategy-Ticker] circuit breaker tick failed", e);
        }
        try {
            rateLimiter.tick();
        } catch (RuntimeException e) {
            log.error("[Strategy-Ticker] rate limiter tick failed", e);
        }
    }

    private void schedule() {
        if (!running.get()) {
            return;
        }
        try {
            pending = timer.newTimeout(t -> {
                try {
                    tickOnce();
                } finally {
                    // 重新安排下一次
                    schedule();
                }
            }, interval.toMillis(), TimeUnit.MILLISECONDS);
        } catch (IllegalStateException | RejectedExecutionException e) {
            // 时间轮已停止或积压过多
            running.set(false);
            log.error("[Strategy-Ticker] failed to schedule next tick, ticker stopped", e);
        }
    }
}
