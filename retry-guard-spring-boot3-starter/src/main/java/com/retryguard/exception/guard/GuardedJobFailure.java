package com.retryguard.exception.guard;

import com.retryguard.model.Classification;
import com.retryguard.model.NextAction;
import lombok.Getter;

/**
 * 任务执行失败，携带分类结果与下一步动作，由调度器决定重试 / 死信 / 丢弃
 */
@Getter
public class GuardedJobFailure extends RuntimeException {

    private final transient Classification classification;

    private final transient NextAction nextAction;

    public GuardedJobFailure(Throwable cause, Classification classification, NextAction nextAction) {
        super("job failed [" + classification.getErrorClass() + "] -> " + nextAction.getOutcome(), cause);
        this.classification = classification;
        this.nextAction = nextAction;
    }
}
