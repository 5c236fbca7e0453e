package com.retryguard.model.error;

/**
 * 可被模式匹配探测的错误字段（code / reason / type），未提供的返回 null
 */
public interface ErrorAttributes {

    default String code() { return null; }

    default String reason() { return null; }

    default String type() { return null; }
}
