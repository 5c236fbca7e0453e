package com.retryguard.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 调度器传入的任务描述，用于选择限流桶（及按约定选择熔断器）
 */
@Getter
@Builder
@ToString
public class JobDescriptor {

    public static final String DEFAULT_QUEUE = "default";

    /** worker 标识（通常为处理器类名），可为空 */
    private final String worker;

    /** 队列名，为空时按 default 队列处理 */
    private final String queue;

    public static JobDescriptor of(String worker, String queue) {
        return new JobDescriptor(worker, queue);
    }

    public String queueOrDefault() {
        return queue == null || queue.isBlank() ? DEFAULT_QUEUE : queue;
    }

    public boolean hasWorker() {
        return worker != null && !worker.isBlank();
    }
}
