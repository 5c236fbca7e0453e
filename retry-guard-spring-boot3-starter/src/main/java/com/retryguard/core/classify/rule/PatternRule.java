package com.retryguard.core.classify.rule;

import com.retryguard.core.classify.pattern.ErrorPattern;
import com.retryguard.core.classify.pattern.ErrorPatterns;

import java.util.List;
import java.util.Objects;

/**
 * 基于模式表的规则
 */
public abstract class PatternRule implements ClassificationRule {

    private final List<ErrorPattern> patterns;

    protected PatternRule(List<ErrorPattern> patterns) {
        this.patterns = Objects.requireNonNull(patterns, "patterns");
    }

    @Override
    public boolean supports(Object error) {
        return ErrorPatterns.anyMatch(patterns, error);
    }
}
