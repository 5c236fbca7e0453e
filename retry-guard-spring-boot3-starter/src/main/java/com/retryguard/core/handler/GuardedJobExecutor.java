package com.retryguard.core.handler;

import com.retryguard.core.spi.CircuitBreaker;
import com.retryguard.core.spi.ErrorClassifier;
import com.retryguard.core.spi.RateLimiter;
import com.retryguard.exception.guard.CircuitOpenException;
import com.retryguard.exception.guard.GuardedJobFailure;
import com.retryguard.exception.guard.RateLimitedException;
import com.retryguard.model.Admission;
import com.retryguard.model.Classification;
import com.retryguard.model.JobDescriptor;
import com.retryguard.model.NextAction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * 执行前后咨询三个策略的组合入口
 * <p>
 * 顺序：限流(worker -> queue -> global) -> 熔断 -> 执行 -> 记录结果 -> 分类
 * <p>
 * 只做判定不做重试，重试 / 死信 / 丢弃由调度器按 {@link NextAction} 执行
 */
@Slf4j
public class GuardedJobExecutor {

    private final ErrorClassifier classifier;

    private final CircuitBreaker circuitBreaker;

    private final RateLimiter rateLimiter;

    public GuardedJobExecutor(ErrorClassifier classifier, CircuitBreaker circuitBreaker, RateLimiter rateLimiter) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.circuitBreaker = Objects.requireNonNull(circuitBreaker, "circuitBreaker");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
    }

    /**
     * 执行前检查
     * @param circuit 受保护依赖名，为空时跳过熔断检查
     * @return 首个拒绝结果，全部通过返回 ADMITTED
     */
    public Admission preExecuteCheck(JobDescriptor job, @Nullable String circuit) {
        Admission rl = rateLimiter.acquireForJob(job);
        if (rl.isRateLimited()) {
            return rl;
        }
        if (circuit != null) {
            Admission cb = circuitBreaker.allow(circuit);
            if (!cb.isPermitted()) {
                return cb;
            }
        }
        return Admission.admitted();
    }

    /**
     * 记录执行结果
     * @param error 为空表示成功；失败时仅计入会触发熔断的错误
     */
    public void recordResult(@Nullable String circuit, @Nullable Object error) {
        if (circuit == null) {
            return;
        }
        if (error == null) {
            circuitBreaker.recordSuccess(circuit);
        } else if (classifier.tripsCircuit(error)) {
            circuitBreaker.recordFailure(circuit, error);
        }
    }

    /**
     * 执行一次尝试
     * @param attempt 本次是第几次尝试（从1开始）
     * @throws RateLimitedException 被限流，任务未执行
     * @throws CircuitOpenException 熔断打开，任务未执行
     * @throws GuardedJobFailure    任务失败，携带分类与下一步动作
     */
    public <T> T execute(JobDescriptor job, @Nullable String circuit, int attempt, Callable<T> work) {
        Admission admission = preExecuteCheck(job, circuit);
        if (admission.isRateLimited()) {
            throw new RateLimitedException(admission.getSource(), admission.getRetryAfterMs());
        }
        if (admission.isCircuitOpen()) {
            throw new CircuitOpenException(admission.getSource());
        }

        T result;
        try {
            result = work.call();
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            recordResult(circuit, e);
            Classification c = classifier.classify(e);
            NextAction next = classifier.nextAction(e, attempt);
            log.debug("[Guarded-Executor] job worker={} queue={} attempt={} failed, class={}, next={}",
                    job.getWorker(), job.queueOrDefault(), attempt, c.getErrorClass(), next);
            throw new GuardedJobFailure(e, c, next);
        }
        recordResult(circuit, null);
        return result;
    }
}
