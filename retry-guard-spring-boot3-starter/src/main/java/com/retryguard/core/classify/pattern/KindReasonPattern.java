package com.retryguard.core.classify.pattern;

import com.retryguard.model.error.TaggedError;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Objects;

/**
 * kind/reason 模式，匹配同 kind 同 reason 的 TaggedError（忽略 detail）
 */
@Getter
@EqualsAndHashCode
public final class KindReasonPattern implements ErrorPattern {

    private final String kind;

    private final String reason;

    public KindReasonPattern(String kind, String reason) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    @Override
    public boolean matches(Object error) {
        return error instanceof TaggedError t
                && kind.equals(t.getKind())
                && reason.equals(t.getReason());
    }

    @Override
    public String toString() {
        return kind + ErrorPatterns.SEPARATOR + reason;
    }
}
