package com.retryguard.model;

import com.retryguard.model.enums.ErrorClass;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 失败后的下一步动作，由调度器执行
 */
@Getter
@ToString
@EqualsAndHashCode
public final class NextAction {

    private final Outcome outcome;

    /** 仅 RETRY 有意义 */
    private final long delayMs;

    private final ErrorClass errorClass;

    private NextAction(Outcome outcome, long delayMs, ErrorClass errorClass) {
        this.outcome = outcome;
        this.delayMs = delayMs;
        this.errorClass = errorClass;
    }

    public static NextAction retry(long delayMs, ErrorClass c) { return new NextAction(Outcome.RETRY, delayMs, c); }

    public static NextAction deadLetter(ErrorClass c) { return new NextAction(Outcome.DEAD_LETTER, 0L, c); }

    public static NextAction discard(ErrorClass c) { return new NextAction(Outcome.DISCARD, 0L, c); }

    public boolean isRetry() { return outcome == Outcome.RETRY; }

    public enum Outcome { RETRY, DEAD_LETTER, DISCARD }
}
