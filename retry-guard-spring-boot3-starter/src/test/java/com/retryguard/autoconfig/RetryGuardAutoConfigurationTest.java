package com.retryguard.autoconfig;

import com.retryguard.core.StrategyTicker;
import com.retryguard.core.circuit.DefaultCircuitBreaker;
import com.retryguard.core.circuit.NoopCircuitBreaker;
import com.retryguard.core.classify.DefaultErrorClassifier;
import com.retryguard.core.event.StrategyEventPublisher;
import com.retryguard.core.event.listener.LoggingEventListener;
import com.retryguard.core.event.listener.MetricsEventListener;
import com.retryguard.core.handler.GuardedJobExecutor;
import com.retryguard.core.metric.GuardMetrics;
import com.retryguard.core.ratelimit.BucketKey;
import com.retryguard.core.ratelimit.NoopRateLimiter;
import com.retryguard.core.ratelimit.TokenBucketRateLimiter;
import com.retryguard.core.spi.CircuitBreaker;
import com.retryguard.core.spi.ErrorClassifier;
import com.retryguard.core.spi.RateLimiter;
import com.retryguard.model.JobDescriptor;
import com.retryguard.model.enums.CircuitState;
import com.retryguard.model.enums.ErrorClass;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RetryGuardAutoConfiguration")
class RetryGuardAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    RetryGuardAutoConfiguration.class,
                    RetryGuardMetricsAutoConfiguration.class))
            .withPropertyValues("retry.guard.tick.interval=0");

    @Test
    @DisplayName("registers default strategies")
    void defaults() {
        runner.run(ctx -> {
            assertThat(ctx).hasNotFailed();
            assertThat(ctx).hasSingleBean(GuardedJobExecutor.class);
            assertThat(ctx.getBean(ErrorClassifier.class)).isInstanceOf(DefaultErrorClassifier.class);
            assertThat(ctx.getBean(CircuitBreaker.class)).isInstanceOf(DefaultCircuitBreaker.class);
            assertThat(ctx.getBean(RateLimiter.class)).isInstanceOf(TokenBucketRateLimiter.class);
            assertThat(ctx).hasSingleBean(StrategyTicker.class);
            assertThat(ctx).hasSingleBean(LoggingEventListener.class);
            assertThat(ctx).hasSingleBean(MetricsEventListener.class);
            assertThat(ctx.getBean(StrategyEventPublisher.class).listeners()).hasSize(2);
        });
    }

    @Test
    @DisplayName("binds limits, circuits and classification tables")
    void bindsProperties() {
        runner.withPropertyValues(
                        "retry.guard.rate-limiter.limits[0].scope=global",
                        "retry.guard.rate-limiter.limits[0].limit=1000",
                        "retry.guard.rate-limiter.limits[0].period=1m",
                        "retry.guard.rate-limiter.limits[1].scope=queue",
                        "retry.guard.rate-limiter.limits[1].key=api",
                        "retry.guard.rate-limiter.limits[1].limit=1",
                        "retry.guard.rate-limiter.limits[1].period=1m",
                        "retry.guard.circuit-breaker.circuits.external-api.failure-threshold=1",
                        "retry.guard.error-classification.terminal-patterns=gone",
                        "retry.guard.error-classification.max-retries-by-class.retryable=9",
                        "retry.guard.events.metric-tags.application=billing")
                .run(ctx -> {
                    assertThat(ctx).hasNotFailed();
                    RateLimiter rl = ctx.getBean(RateLimiter.class);
                    assertThat(rl.status()).containsKeys(BucketKey.GLOBAL, BucketKey.queue("api"));

                    GuardedJobExecutor executor = ctx.getBean(GuardedJobExecutor.class);
                    JobDescriptor job = JobDescriptor.of(null, "api");
                    assertThat(executor.preExecuteCheck(job, "external-api").isPermitted()).isTrue();
                    assertThat(executor.preExecuteCheck(job, "external-api").isRateLimited()).isTrue();

                    CircuitBreaker cb = ctx.getBean(CircuitBreaker.class);
                    executor.recordResult("external-api", "timeout");
                    assertThat(cb.getState("external-api").orElseThrow().getState()).isEqualTo(CircuitState.OPEN);

                    ErrorClassifier classifier = ctx.getBean(ErrorClassifier.class);
                    assertThat(classifier.errorClass("gone")).isEqualTo(ErrorClass.TERMINAL);
                    assertThat(classifier.errorClass("not_found")).isEqualTo(ErrorClass.UNKNOWN);
                    assertThat(classifier.classify("timeout").getMaxRetries()).isEqualTo(9);

                    GuardMetrics metrics = ctx.getBean(GuardMetrics.class);
                    assertThat(metrics.registry().get(GuardMetrics.CIRCUIT_TRIP)
                            .tag("application", "billing").counter().count()).isEqualTo(1.0d);
                });
    }

    @Test
    @DisplayName("disabled strategies fall back to no-op variants")
    void disabled() {
        runner.withPropertyValues(
                        "retry.guard.circuit-breaker.enabled=false",
                        "retry.guard.rate-limiter.enabled=false",
                        "retry.guard.events.log-enabled=false",
                        "retry.guard.events.metrics-enabled=false")
                .run(ctx -> {
                    assertThat(ctx.getBean(CircuitBreaker.class)).isInstanceOf(NoopCircuitBreaker.class);
                    assertThat(ctx.getBean(RateLimiter.class)).isInstanceOf(NoopRateLimiter.class);
                    assertThat(ctx).doesNotHaveBean(LoggingEventListener.class);
                    assertThat(ctx).doesNotHaveBean(MetricsEventListener.class);
                });
    }

    @Test
    @DisplayName("application beans replace the defaults")
    void userBeans() {
        runner.withBean(CircuitBreaker.class, NoopCircuitBreaker::new)
                .withBean(SimpleMeterRegistry.class, SimpleMeterRegistry::new)
                .run(ctx -> {
                    assertThat(ctx).hasSingleBean(CircuitBreaker.class);
                    assertThat(ctx.getBean(CircuitBreaker.class)).isInstanceOf(NoopCircuitBreaker.class);
                });
    }

    @Test
    @DisplayName("invalid configuration fails startup")
    void invalidConfig() {
        runner.withPropertyValues(
                        "retry.guard.rate-limiter.limits[0].scope=queue",
                        "retry.guard.rate-limiter.limits[0].limit=10")
                .run(ctx -> assertThat(ctx).hasFailed());
    }
}
