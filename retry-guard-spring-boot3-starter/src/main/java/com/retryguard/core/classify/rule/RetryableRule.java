package com.retryguard.core.classify.rule;

import com.retryguard.core.classify.BackoffSpec;
import com.retryguard.core.classify.ClassifierSettings;
import com.retryguard.model.Classification;
import com.retryguard.model.enums.BackoffShape;
import com.retryguard.model.enums.ErrorClass;

/**
 * 可重试错误：指数回退，计入熔断
 */
public class RetryableRule extends PatternRule {

    public RetryableRule(ClassifierSettings settings) {
        super(settings.getRetryablePatterns());
    }

    @Override
    public Classification classify(ClassifierSettings settings) {
        return retryable(settings);
    }

    static Classification retryable(ClassifierSettings settings) {
        BackoffSpec b = settings.backoff(ErrorClass.RETRYABLE);
        return Classification.builder()
                .errorClass(ErrorClass.RETRYABLE)
                .retryable(true)
                .maxRetries(settings.maxRetries(ErrorClass.RETRYABLE))
                .strategy(BackoffShape.EXPONENTIAL)
                .baseDelayMs(b.getBaseMs())
                .maxDelayMs(b.getMaxMs())
                .tripsCircuit(true)
                .build();
    }
}
