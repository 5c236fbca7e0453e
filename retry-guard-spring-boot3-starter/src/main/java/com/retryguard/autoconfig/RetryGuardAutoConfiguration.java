package com.retryguard.autoconfig;

import com.retryguard.config.RetryGuardProperties;
import com.retryguard.core.StrategyTicker;
import com.retryguard.core.backoff.BackoffRegistry;
import com.retryguard.core.circuit.DefaultCircuitBreaker;
import com.retryguard.core.circuit.NoopCircuitBreaker;
import com.retryguard.core.classify.DefaultErrorClassifier;
import com.retryguard.core.clock.GuardClock;
import com.retryguard.core.event.StrategyEventPublisher;
import com.retryguard.core.event.listener.LoggingEventListener;
import com.retryguard.core.handler.GuardedJobExecutor;
import com.retryguard.core.ratelimit.NoopRateLimiter;
import com.retryguard.core.ratelimit.TokenBucketRateLimiter;
import com.retryguard.core.spi.BackoffPolicy;
import com.retryguard.core.spi.CircuitBreaker;
import com.retryguard.core.spi.ErrorClassifier;
import com.retryguard.core.spi.RateLimiter;
import com.retryguard.core.spi.StrategyEventListener;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import io.netty.util.HashedWheelTimer;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

@AutoConfiguration
@EnableConfigurationProperties({
        RetryGuardProperties.class
})
public class RetryGuardAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public GuardClock guardClock() {
        return GuardClock.SYSTEM;
    }

    /**
     * 回退策略注册中心，应用注册的同形态策略覆盖内置
     */
    @Bean
    @ConditionalOnMissingBean
    public BackoffRegistry backoffRegistry(ObjectProvider<BackoffPolicy> discovered) {
        return new BackoffRegistry(discovered.orderedStream().collect(Collectors.toList()));
    }

    @Bean
    @ConditionalOnMissingBean(ErrorClassifier.class)
    public ErrorClassifier errorClassifier(RetryGuardProperties props, BackoffRegistry backoffRegistry) {
        return new DefaultErrorClassifier(props.toClassifierSettings(), backoffRegistry);
    }

    @Bean
    @ConditionalOnProperty(prefix = "retry.guard.events", name = "log-enabled", havingValue = "true", matchIfMissing = true)
    public LoggingEventListener loggingEventListener() {
        return new LoggingEventListener();
    }

    @Bean
    @ConditionalOnMissingBean
    public StrategyEventPublisher strategyEventPublisher(ObjectProvider<StrategyEventListener> listeners) {
        return new StrategyEventPublisher(listeners.orderedStream().collect(Collectors.toList()));
    }

    @Bean
    @ConditionalOnMissingBean(CircuitBreaker.class)
    @ConditionalOnProperty(prefix = "retry.guard.circuit-breaker", name = "enabled", havingValue = "true", matchIfMissing = true)
    public CircuitBreaker circuitBreaker(RetryGuardProperties props, StrategyEventPublisher publisher, GuardClock clock) {
        return new DefaultCircuitBreaker(publisher, clock).registerAll(props.toCircuitOptions());
    }

    @Bean
    @ConditionalOnMissingBean(CircuitBreaker.class)
    @ConditionalOnProperty(prefix = "retry.guard.circuit-breaker", name = "enabled", havingValue = "false")
    public CircuitBreaker noopCircuitBreaker() {
        return new NoopCircuitBreaker();
    }

    @Bean
    @ConditionalOnMissingBean(RateLimiter.class)
    @ConditionalOnProperty(prefix = "retry.guard.rate-limiter", name = "enabled", havingValue = "true", matchIfMissing = true)
    public RateLimiter rateLimiter(RetryGuardProperties props, StrategyEventPublisher publisher, GuardClock clock) {
        return new TokenBucketRateLimiter(props.toRateLimitDefinitions(), publisher, clock);
    }

    @Bean
    @ConditionalOnMissingBean(RateLimiter.class)
    @ConditionalOnProperty(prefix = "retry.guard.rate-limiter", name = "enabled", havingValue = "false")
    public RateLimiter noopRateLimiter() {
        return new NoopRateLimiter();
    }

    /**
     * 执行前后统一入口
     */
    @Bean
    @ConditionalOnMissingBean
    public GuardedJobExecutor guardedJobExecutor(ErrorClassifier classifier,
                                                 CircuitBreaker circuitBreaker,
                                                 RateLimiter rateLimiter) {
        return new GuardedJobExecutor(classifier, circuitBreaker, rateLimiter);
    }

    @Bean(name = "strategyTickTimer", destroyMethod = "stop")
    @ConditionalOnMissingBean(name = "strategyTickTimer")
    public HashedWheelTimer strategyTickTimer(RetryGuardProperties props) {
        RetryGuardProperties.Tick tick = props.getTick();
        return new HashedWheelTimer(
                new NamedThreadFactory("retry-guard-tick"),
                tick.getWheelTickDuration().toMillis(),
                TimeUnit.MILLISECONDS,
                tick.getTicksPerWheel(),
                false,
                16);
    }

    @Bean
    @ConditionalOnMissingBean
    public StrategyTicker strategyTicker(HashedWheelTimer strategyTickTimer,
                                         CircuitBreaker circuitBreaker,
                                         RateLimiter rateLimiter,
                                         RetryGuardProperties props) {
        return new StrategyTicker(strategyTickTimer, circuitBreaker, rateLimiter, props.getTick().getInterval());
    }
}
