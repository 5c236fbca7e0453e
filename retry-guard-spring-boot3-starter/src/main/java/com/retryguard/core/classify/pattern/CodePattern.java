package com.retryguard.core.classify.pattern;

import com.retryguard.model.error.ErrorAttributes;
import com.retryguard.model.error.TaggedError;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Map;
import java.util.Objects;

/**
 * 错误码模式，匹配：
 * - 相等的字符串
 * - 名称相同（忽略大小写）的枚举
 * - kind 相同的二元 TaggedError
 * - code / reason / type 任一相同的 ErrorAttributes 或 Map
 */
@Getter
@EqualsAndHashCode
public final class CodePattern implements ErrorPattern {

    private final String code;

    public CodePattern(String code) {
        this.code = Objects.requireNonNull(code, "code");
    }

    @Override
    public boolean matches(Object error) {
        if (error == null) {
            return false;
        }
        if (error instanceof String s) {
            return code.equals(s);
        }
        if (error instanceof Enum<?> e) {
            return code.equalsIgnoreCase(e.name());
        }
        if (error instanceof TaggedError t) {
            return t.isPair() && code.equals(t.getKind());
        }
        if (error instanceof ErrorAttributes a) {
            return code.equals(a.code()) || code.equals(a.reason()) || code.equals(a.type());
        }
        if (error instanceof Map<?, ?> m) {
            return matchesFields(m);
        }
        return false;
    }

    // 遍历条目而不调用 get，键类型不一致的有序 Map 不会抛 ClassCastException
    private boolean matchesFields(Map<?, ?> m) {
        for (Map.Entry<?, ?> entry : m.entrySet()) {
            Object key = entry.getKey();
            if (("code".equals(key) || "reason".equals(key) || "type".equals(key))
                    && code.equals(asString(entry.getValue()))) {
                return true;
            }
        }
        return false;
    }

    private static String asString(Object v) {
        if (v == null) {
            return null;
        }
        if (v instanceof Enum<?> e) {
            return e.name().toLowerCase(java.util.Locale.ROOT);
        }
        return v.toString();
    }

    @Override
    public String toString() {
        return code;
    }
}
