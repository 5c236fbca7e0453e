package com.retryguard.core.classify.pattern;

/**
 * 错误匹配模式：错误码（timeout）或 kind/reason 二元组（exit:timeout）
 */
public interface ErrorPattern {

    boolean matches(Object error);
}
