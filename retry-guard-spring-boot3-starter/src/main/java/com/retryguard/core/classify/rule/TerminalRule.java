package com.retryguard.core.classify.rule;

import com.retryguard.core.classify.ClassifierSettings;
import com.retryguard.model.Classification;
import com.retryguard.model.enums.BackoffShape;
import com.retryguard.model.enums.ErrorClass;

/**
 * 终态错误：不重试，不计入熔断
 */
public class TerminalRule extends PatternRule {

    public TerminalRule(ClassifierSettings settings) {
        super(settings.getTerminalPatterns());
    }

    @Override
    public Classification classify(ClassifierSettings settings) {
        return Classification.builder()
                .errorClass(ErrorClass.TERMINAL)
                .retryable(false)
                .maxRetries(settings.maxRetries(ErrorClass.TERMINAL))
                .strategy(BackoffShape.NONE)
                .baseDelayMs(0L)
                .maxDelayMs(0L)
                .tripsCircuit(false)
                .build();
    }
}
