package com.retryguard.core.classify;

import com.retryguard.core.classify.pattern.ErrorPattern;
import com.retryguard.core.classify.pattern.ErrorPatterns;
import com.retryguard.model.enums.ErrorClass;
import lombok.Getter;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 分类器配置：三组模式表 + 各类别最大重试次数 + 各类别回退参数
 * <p>
 * 启动时构建，之后只读
 */
@Getter
public final class ClassifierSettings {

    /** 类别未配置最大重试次数时使用 */
    public static final int FALLBACK_MAX_RETRIES = 3;

    private final List<ErrorPattern> retryablePatterns;

    private final List<ErrorPattern> terminalPatterns;

    private final List<ErrorPattern> transientPatterns;

    private final Map<ErrorClass, Integer> maxRetriesByClass;

    private final Map<ErrorClass, BackoffSpec> backoffByClass;

    private ClassifierSettings(Builder b) {
        this.retryablePatterns = ErrorPatterns.parseAll(b.retryable);
        this.terminalPatterns = ErrorPatterns.parseAll(b.terminal);
        this.transientPatterns = ErrorPatterns.parseAll(b.transientOnes);
        b.maxRetries.forEach((k, v) -> {
            if (v == null || v < 0) {
                throw new IllegalArgumentException("max retries for " + k + " must be >= 0");
            }
        });
        this.maxRetriesByClass = Collections.unmodifiableMap(new EnumMap<>(b.maxRetries));
        this.backoffByClass = Collections.unmodifiableMap(new EnumMap<>(b.backoff));
    }

    public static ClassifierSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int maxRetries(ErrorClass c) {
        return maxRetriesByClass.getOrDefault(c, FALLBACK_MAX_RETRIES);
    }

    public BackoffSpec backoff(ErrorClass c) {
        return backoffByClass.getOrDefault(c, BackoffSpec.FALLBACK);
    }

    public static final class Builder {

        private Collection<String> retryable = ErrorPatterns.DEFAULT_RETRYABLE;
        private Collection<String> terminal = ErrorPatterns.DEFAULT_TERMINAL;
        private Collection<String> transientOnes = ErrorPatterns.DEFAULT_TRANSIENT;
        private final Map<ErrorClass, Integer> maxRetries = new EnumMap<>(ErrorClass.class);
        private final Map<ErrorClass, BackoffSpec> backoff = new EnumMap<>(ErrorClass.class);

        private Builder() {
            maxRetries.put(ErrorClass.RETRYABLE, 5);
            maxRetries.put(ErrorClass.TRANSIENT, 3);
            maxRetries.put(ErrorClass.DEGRADED, 2);
            maxRetries.put(ErrorClass.TERMINAL, 0);
            maxRetries.put(ErrorClass.UNKNOWN, 3);
            backoff.put(ErrorClass.RETRYABLE, BackoffSpec.exponential(1_000L, 60_000L));
            backoff.put(ErrorClass.TRANSIENT, BackoffSpec.fixed(500L));
            backoff.put(ErrorClass.DEGRADED, BackoffSpec.exponential(5_000L, 300_000L));
        }

        /** 替换整张模式表，null 保留默认 */
        public Builder retryablePatterns(Collection<String> patterns) {
            if (patterns != null) {
                this.retryable = patterns;
            }
            return this;
        }

        public Builder terminalPatterns(Collection<String> patterns) {
            if (patterns != null) {
                this.terminal = patterns;
            }
            return this;
        }

        public Builder transientPatterns(Collection<String> patterns) {
            if (patterns != null) {
                this.transientOnes = patterns;
            }
            return this;
        }

        /** 覆盖单个类别，未覆盖的类别保留默认值 */
        public Builder maxRetries(ErrorClass c, int max) {
            maxRetries.put(c, max);
            return this;
        }

        public Builder backoff(ErrorClass c, BackoffSpec spec) {
            backoff.put(c, spec);
            return this;
        }

        public ClassifierSettings build() {
            return new ClassifierSettings(this);
        }
    }
}
