package com.retryguard.core.classify.pattern;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * 模式解析与默认模式表
 */
public final class ErrorPatterns {

    public static final String SEPARATOR = ":";

    public static final List<String> DEFAULT_RETRYABLE = List.of(
            "timeout", "connection_refused", "connection_closed", "econnrefused", "econnreset",
            "etimedout", "rate_limited", "service_unavailable", "bad_gateway", "gateway_timeout",
            "exit:timeout", "exit:noproc");

    public static final List<String> DEFAULT_TERMINAL = List.of(
            "invalid_args", "invalid_argument", "not_found", "unauthorized", "forbidden",
            "bad_request", "validation_error", "schema_error", "undefined_function");

    public static final List<String> DEFAULT_TRANSIENT = List.of(
            "busy", "overloaded", "try_again", "temporary_failure");

    private ErrorPatterns() {
    }

    /**
     * 解析单个模式："code" 或 "kind:reason"
     * @throws IllegalArgumentException 模式为空或格式错误
     */
    public static ErrorPattern parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("error pattern must not be blank");
        }
        String s = raw.trim();
        int idx = s.indexOf(SEPARATOR);
        if (idx < 0) {
            return new CodePattern(s);
        }
        String kind = s.substring(0, idx).trim();
        String reason = s.substring(idx + 1).trim();
        if (kind.isEmpty() || reason.isEmpty()) {
            throw new IllegalArgumentException("invalid error pattern: " + raw);
        }
        return new KindReasonPattern(kind, reason);
    }

    public static List<ErrorPattern> parseAll(Collection<String> raw) {
        if (raw == null || raw.isEmpty()) {
            return Collections.emptyList();
        }
        List<ErrorPattern> out = new ArrayList<>(raw.size());
        raw.forEach(r -> out.add(parse(r)));
        return Collections.unmodifiableList(out);
    }

    public static boolean anyMatch(List<ErrorPattern> patterns, Object error) {
        for (ErrorPattern p : patterns) {
            if (p.matches(error)) {
                return true;
            }
        }
        return false;
    }
}
