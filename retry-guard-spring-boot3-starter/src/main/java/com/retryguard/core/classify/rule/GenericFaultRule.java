package com.retryguard.core.classify.rule;

import com.retryguard.core.classify.ClassifierSettings;
import com.retryguard.model.Classification;
import com.retryguard.model.error.TaggedError;

/**
 * 未命中任何模式的异常（Throwable 或 exception 类 TaggedError）按可重试处理
 */
public class GenericFaultRule implements ClassificationRule {

    @Override
    public boolean supports(Object error) {
        if (error instanceof Throwable) {
            return true;
        }
        return error instanceof TaggedError t
                && TaggedError.EXCEPTION_KIND.equals(t.getKind())
                && !t.isPair();
    }

    @Override
    public Classification classify(ClassifierSettings settings) {
        return RetryableRule.retryable(settings);
    }
}
