package com.retryguard.core.backoff;

import com.retryguard.core.spi.BackoffPolicy;
import com.retryguard.model.enums.BackoffShape;
import org.springframework.lang.Nullable;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 策略注册中心：
 * - 内置 none / fixed / exponential
 * - 应用注册的同形态 BackoffPolicy 覆盖内置实现
 * - 构造后只读，线程安全
 */
public class BackoffRegistry {

    private final Map<BackoffShape, BackoffPolicy> policies = new EnumMap<>(BackoffShape.class);

    public BackoffRegistry(@Nullable List<BackoffPolicy> discovered) {
        if (discovered != null) {
            discovered.forEach(p -> policies.put(Objects.requireNonNull(p.shape(), "shape"), p));
        }
        // 内置策略
        policies.putIfAbsent(BackoffShape.NONE, new NoBackoffPolicy());
        policies.putIfAbsent(BackoffShape.FIXED, new FixedBackoffPolicy());
        policies.putIfAbsent(BackoffShape.EXPONENTIAL, new ExponentialJitterBackoffPolicy());
    }

    public BackoffRegistry() {
        this(null);
    }

    /**
     * 按形态解析策略，为空时采用 exponential
     */
    public BackoffPolicy resolve(@Nullable BackoffShape shape) {
        if (shape == null) {
            return policies.get(BackoffShape.EXPONENTIAL);
        }
        return policies.get(shape);
    }

    /**
     * 计算延迟
     */
    public long delayMillis(@Nullable BackoffShape shape, int attempt, long baseMs, long maxMs) {
        return resolve(shape).delayMillis(attempt, baseMs, maxMs);
    }

    /** 列出已注册策略 */
    public Map<BackoffShape, BackoffPolicy> policies() { return Collections.unmodifiableMap(policies); }
}
