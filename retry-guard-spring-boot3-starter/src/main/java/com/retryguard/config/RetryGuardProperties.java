package com.retryguard.config;

import com.retryguard.core.circuit.CircuitOptions;
import com.retryguard.core.classify.BackoffSpec;
import com.retryguard.core.classify.ClassifierSettings;
import com.retryguard.core.ratelimit.RateLimitDefinition;
import com.retryguard.model.enums.BackoffShape;
import com.retryguard.model.enums.ErrorClass;
import com.retryguard.model.enums.RateLimitScope;
import lombok.Data;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * retry:
 *   guard:
 *     tick:
 *       interval: 1s
 *     rate-limiter:
 *       enabled: true
 *       limits:
 *         - { scope: global, limit: 1000, period: 1m }
 *         - { scope: queue, key: api, limit: 100, period: 1m }
 *         - { scope: worker, key: com.acme.ExpensiveWorker, limit: 10, period: 1h }
 *     circuit-breaker:
 *       enabled: true
 *       defaults: { failure-threshold: 5, success-threshold: 2, reset-timeout: 30s, half-open-limit: 3 }
 *       circuits:
 *         external-api: { failure-threshold: 3, reset-timeout: 1m }
 *     error-classification:
 *       retryable-patterns: [timeout, "exit:timeout"]
 *       terminal-patterns: [not_found]
 *       transient-patterns: [busy]
 *       max-retries-by-class: { retryable: 5, transient: 3 }
 *       backoff-by-class:
 *         retryable: { strategy: exponential, base: 1s, max: 60s }
 *         transient: { strategy: fixed, base: 500ms }
 *     events:
 *       log-enabled: true
 *       metrics-enabled: true
 *       metric-tags: { application: billing }
 */
@Data
@ConfigurationProperties(prefix = "retry.guard")
public class RetryGuardProperties implements InitializingBean {

    private Tick tick = new Tick();

    private RateLimiterConfig rateLimiter = new RateLimiterConfig();

    private CircuitBreakerConfig circuitBreaker = new CircuitBreakerConfig();

    private ErrorClassification errorClassification = new ErrorClassification();

    private Events events = new Events();

    @Data
    public static class Tick {
        /** 维护周期，0 关闭 */
        private Duration interval = Duration.ofSeconds(1);
        /** 时间轮精度 */
        private Duration wheelTickDuration = Duration.ofMillis(100);
        private int ticksPerWheel = 64;
    }

    @Data
    public static class RateLimiterConfig {
        private boolean enabled = true;
        private List<Limit> limits = new ArrayList<>();
    }

    @Data
    public static class Limit {
        private RateLimitScope scope = RateLimitScope.GLOBAL;
        /** queue 名或 worker 标识，global 不填 */
        private String key;
        private int limit;
        private Duration period = Duration.ofMinutes(1);
    }

    @Data
    public static class CircuitBreakerConfig {
        private boolean enabled = true;
        /** 未显式配置的字段使用这里的值 */
        private Circuit defaults = new Circuit();
        private Map<String, Circuit> circuits = new LinkedHashMap<>();
    }

    @Data
    public static class Circuit {
        private Integer failureThreshold;
        private Integer successThreshold;
        private Duration resetTimeout;
        private Integer halfOpenLimit;

        CircuitOptions applyTo(CircuitOptions base) {
            CircuitOptions.Builder b = base.toBuilder();
            if (failureThreshold != null) {
                b.failureThreshold(failureThreshold);
            }
            if (successThreshold != null) {
                b.successThreshold(successThreshold);
            }
            if (resetTimeout != null) {
                b.resetTimeout(resetTimeout);
            }
            if (halfOpenLimit != null) {
                b.halfOpenLimit(halfOpenLimit);
            }
            return b.build();
        }
    }

    @Data
    public static class ErrorClassification {
        /** 为空使用内置模式表，配置后整表替换 */
        private List<String> retryablePatterns;
        private List<String> terminalPatterns;
        private List<String> transientPatterns;
        /** 按类别覆盖，未覆盖的类别保留默认 */
        private Map<ErrorClass, Integer> maxRetriesByClass = new LinkedHashMap<>();
        private Map<ErrorClass, Backoff> backoffByClass = new LinkedHashMap<>();
    }

    @Data
    public static class Backoff {
        private BackoffShape strategy = BackoffShape.EXPONENTIAL;
        private Duration base = Duration.ofMillis(BackoffSpec.DEFAULT_BASE_MS);
        private Duration max = Duration.ofMillis(BackoffSpec.DEFAULT_MAX_MS);

        BackoffSpec toSpec() {
            if (strategy == null || base == null || max == null) {
                throw new IllegalArgumentException("retry.guard.error-classification.backoff-by-class entries need strategy, base and max");
            }
            return switch (strategy) {
                case NONE -> BackoffSpec.none();
                case FIXED -> BackoffSpec.fixed(base.toMillis());
                case EXPONENTIAL -> BackoffSpec.exponential(base.toMillis(), max.toMillis());
            };
        }
    }

    @Data
    public static class Events {
        private boolean logEnabled = true;
        private boolean metricsEnabled = true;
        /** 附加到所有 retry.guard.* 计数器上的公共 tag */
        private Map<String, String> metricTags = new LinkedHashMap<>();
    }

    public List<RateLimitDefinition> toRateLimitDefinitions() {
        List<RateLimitDefinition> out = new ArrayList<>(rateLimiter.getLimits().size());
        for (Limit l : rateLimiter.getLimits()) {
            if (l.getScope() == null) {
                throw new IllegalArgumentException("retry.guard.rate-limiter.limits[].scope is required");
            }
            out.add(RateLimitDefinition.of(l.getScope(), l.getKey(), l.getLimit(), l.getPeriod()));
        }
        return out;
    }

    public CircuitOptions defaultCircuitOptions() {
        Circuit d = circuitBreaker.getDefaults();
        return d == null ? CircuitOptions.defaults() : d.applyTo(CircuitOptions.defaults());
    }

    public Map<String, CircuitOptions> toCircuitOptions() {
        CircuitOptions base = defaultCircuitOptions();
        Map<String, CircuitOptions> out = new LinkedHashMap<>();
        circuitBreaker.getCircuits().forEach((name, c) -> out.put(name, c == null ? base : c.applyTo(base)));
        return out;
    }

    public ClassifierSettings toClassifierSettings() {
        ClassifierSettings.Builder b = ClassifierSettings.builder()
                .retryablePatterns(errorClassification.getRetryablePatterns())
                .terminalPatterns(errorClassification.getTerminalPatterns())
                .transientPatterns(errorClassification.getTransientPatterns());
        errorClassification.getMaxRetriesByClass().forEach((k, v) -> {
            if (v == null) {
                throw new IllegalArgumentException("retry.guard.error-classification.max-retries-by-class." + k + " is empty");
            }
            b.maxRetries(k, v);
        });
        errorClassification.getBackoffByClass().forEach((k, v) -> b.backoff(k, v.toSpec()));
        return b.build();
    }

    @Override
    public void afterPropertiesSet() {
        // 参数校验，配置错误启动失败
        Duration interval = tick.getInterval();
        if (interval == null || interval.isNegative()) {
            throw new IllegalArgumentException("retry.guard.tick.interval must be >= 0");
        }
        if (tick.getWheelTickDuration() == null || tick.getWheelTickDuration().toMillis() <= 0) {
            throw new IllegalArgumentException("retry.guard.tick.wheel-tick-duration must be >= 1ms");
        }
        if (tick.getTicksPerWheel() <= 0) {
            throw new IllegalArgumentException("retry.guard.tick.ticks-per-wheel must be > 0");
        }
        toRateLimitDefinitions();
        toCircuitOptions();
        toClassifierSettings();
    }
}
