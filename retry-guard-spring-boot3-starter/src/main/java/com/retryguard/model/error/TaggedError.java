package com.retryguard.model.error;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * {kind, reason} 形式的结构化错误，可附带 detail
 * <p>
 * 例：{@code TaggedError.of("exit", "timeout")}、{@code TaggedError.of("exception", "io", ex)}
 */
@Getter
@ToString
@EqualsAndHashCode
public final class TaggedError {

    public static final String EXCEPTION_KIND = "exception";

    private final String kind;

    private final String reason;

    private final Object detail;

    /** 三元组形式，detail 为 null 时同样成立 */
    private final boolean triple;

    private TaggedError(String kind, String reason, Object detail, boolean triple) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.reason = reason;
        this.detail = detail;
        this.triple = triple;
    }

    public static TaggedError of(String kind, String reason) {
        return new TaggedError(kind, reason, null, false);
    }

    public static TaggedError of(String kind, String reason, Object detail) {
        return new TaggedError(kind, reason, detail, true);
    }

    /** 二元组形式 */
    public boolean isPair() {
        return !triple;
    }
}
