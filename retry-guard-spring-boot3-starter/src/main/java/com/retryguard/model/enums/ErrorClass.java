package com.retryguard.model.enums;

/**
 * 错误分类
 */
public enum ErrorClass {
    /** 可重试（超时、连接失败等基础设施故障），会触发熔断计数 */
    RETRYABLE,

    /** 短暂故障，预期很快自愈 */
    TRANSIENT,

    /** 服务降级，仅允许少量重试 */
    DEGRADED,

    /** 永久失败（参数、鉴权等），不重试 */
    TERMINAL,

    /** 无法识别，按保守默认值重试 */
    UNKNOWN
}
