package com.retryguard.core.classify.rule;

import com.retryguard.core.classify.BackoffSpec;
import com.retryguard.core.classify.ClassifierSettings;
import com.retryguard.model.Classification;
import com.retryguard.model.enums.BackoffShape;
import com.retryguard.model.enums.ErrorClass;

/**
 * 短暂错误：固定间隔重试，不计入熔断
 */
public class TransientRule extends PatternRule {

    public TransientRule(ClassifierSettings settings) {
        super(settings.getTransientPatterns());
    }

    @Override
    public Classification classify(ClassifierSettings settings) {
        BackoffSpec b = settings.backoff(ErrorClass.TRANSIENT);
        return Classification.builder()
                .errorClass(ErrorClass.TRANSIENT)
                .retryable(true)
                .maxRetries(settings.maxRetries(ErrorClass.TRANSIENT))
                .strategy(BackoffShape.FIXED)
                .baseDelayMs(b.getBaseMs())
                .maxDelayMs(b.getMaxMs())
                .tripsCircuit(false)
                .build();
    }
}
