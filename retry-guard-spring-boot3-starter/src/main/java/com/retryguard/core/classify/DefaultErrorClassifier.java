package com.retryguard.core.classify;

import com.retryguard.core.backoff.BackoffRegistry;
import com.retryguard.core.classify.rule.ClassificationRule;
import com.retryguard.core.classify.rule.GenericFaultRule;
import com.retryguard.core.classify.rule.RetryableRule;
import com.retryguard.core.classify.rule.TerminalRule;
import com.retryguard.core.classify.rule.TransientRule;
import com.retryguard.core.spi.ErrorClassifier;
import com.retryguard.core.spi.Recoverable;
import com.retryguard.model.Classification;
import com.retryguard.model.NextAction;
import com.retryguard.model.enums.BackoffShape;
import com.retryguard.model.enums.ErrorClass;
import com.retryguard.model.enums.RecoveryStrategy;
import com.retryguard.model.enums.Severity;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;

/**
 * 默认分类器
 * <p>
 * 1. 错误实现 {@link Recoverable} 时按其自描述分类
 * 2. 否则按规则顺序匹配：terminal -> transient -> retryable -> 通用异常
 * 3. 都未命中归为 UNKNOWN（保守可重试）
 */
@Slf4j
public class DefaultErrorClassifier implements ErrorClassifier {

    static final long CAPABILITY_BASE_DELAY_MS = 1_000L;
    static final long CAPABILITY_MAX_DELAY_MS = 60_000L;
    static final long UNKNOWN_BASE_DELAY_MS = 1_000L;
    static final long UNKNOWN_MAX_DELAY_MS = 30_000L;

    private final ClassifierSettings settings;

    private final BackoffRegistry backoffRegistry;

    private final List<ClassificationRule> rules;

    public DefaultErrorClassifier(ClassifierSettings settings, BackoffRegistry backoffRegistry) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.backoffRegistry = Objects.requireNonNull(backoffRegistry, "backoffRegistry");
        // 顺序即优先级
        this.rules = List.of(
                new TerminalRule(settings),
                new TransientRule(settings),
                new RetryableRule(settings),
                new GenericFaultRule());
    }

    public DefaultErrorClassifier() {
        this(ClassifierSettings.defaults(), new BackoffRegistry());
    }

    @Override
    public Classification classify(Object error) {
        if (error instanceof Recoverable r) {
            Classification c = classifyByCapability(r);
            if (c != null) {
                return c;
            }
        }
        for (ClassificationRule rule : rules) {
            if (supports(rule, error)) {
                return rule.classify(settings);
            }
        }
        return unknown();
    }

    // 错误对象自身的访问器可能抛异常，视为该规则未命中
    private static boolean supports(ClassificationRule rule, Object error) {
        try {
            return rule.supports(error);
        } catch (RuntimeException e) {
            log.debug("[Classifier] rule {} failed, skipped: {}", rule.getClass().getSimpleName(), e.toString());
            return false;
        }
    }

    @Override
    public long retryDelay(Object error, int attempt) {
        return delayFor(classify(error), attempt);
    }

    @Override
    public NextAction nextAction(Object error, int attempt) {
        Classification c = classify(error);
        if (!c.isRetryable()) {
            return NextAction.discard(c.getErrorClass());
        }
        if (attempt >= c.getMaxRetries()) {
            return NextAction.deadLetter(c.getErrorClass());
        }
        return NextAction.retry(delayFor(c, attempt), c.getErrorClass());
    }

    private long delayFor(Classification c, int attempt) {
        return backoffRegistry.delayMillis(c.getStrategy(), attempt, c.getBaseDelayMs(), c.getMaxDelayMs());
    }

    private Classification classifyByCapability(Recoverable r) {
        try {
            boolean recoverable = r.isRecoverable();
            RecoveryStrategy strategy = r.strategy();
            Severity severity = r.severity();
            int maxAttempts = r.maxAttempts();
            boolean trips = r.tripsCircuit();
            return Classification.builder()
                    .errorClass(toErrorClass(severity))
                    .retryable(recoverable)
                    .maxRetries(maxAttempts)
                    .strategy(toShape(strategy))
                    .baseDelayMs(CAPABILITY_BASE_DELAY_MS)
                    .maxDelayMs(CAPABILITY_MAX_DELAY_MS)
                    .tripsCircuit(trips)
                    .build();
        } catch (RuntimeException e) {
            log.debug("[Classifier] recoverable probe failed on {}, fallback to patterns: {}",
                    r.getClass().getName(), e.toString());
            return null;
        }
    }

    private Classification unknown() {
        return Classification.builder()
                .errorClass(ErrorClass.UNKNOWN)
                .retryable(true)
                .maxRetries(settings.maxRetries(ErrorClass.UNKNOWN))
                .strategy(BackoffShape.EXPONENTIAL)
                .baseDelayMs(UNKNOWN_BASE_DELAY_MS)
                .maxDelayMs(UNKNOWN_MAX_DELAY_MS)
                .tripsCircuit(false)
                .build();
    }

    static ErrorClass toErrorClass(Severity severity) {
        if (severity == null) {
            return ErrorClass.UNKNOWN;
        }
        return switch (severity) {
            case TRANSIENT -> ErrorClass.TRANSIENT;
            case DEGRADED -> ErrorClass.DEGRADED;
            case CRITICAL -> ErrorClass.RETRYABLE;
            case PERMANENT -> ErrorClass.TERMINAL;
        };
    }

    static BackoffShape toShape(RecoveryStrategy strategy) {
        if (strategy == null) {
            return BackoffShape.EXPONENTIAL;
        }
        return switch (strategy) {
            case RETRY, WAIT_UNTIL -> BackoffShape.FIXED;
            case RETRY_WITH_BACKOFF -> BackoffShape.EXPONENTIAL;
            case CIRCUIT_BREAK, FAIL_FAST, FALLBACK -> BackoffShape.NONE;
        };
    }
}
