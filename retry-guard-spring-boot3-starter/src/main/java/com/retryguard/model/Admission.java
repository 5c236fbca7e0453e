package com.retryguard.model;

import com.retryguard.model.enums.AdmissionStatus;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 准入判定结果（限流 / 熔断共用）
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Admission {

    private static final Admission ADMITTED = new Admission(AdmissionStatus.ADMITTED, 0L, null);
    private static final Admission NOT_CONFIGURED = new Admission(AdmissionStatus.NOT_CONFIGURED, 0L, null);

    private final AdmissionStatus status;

    /** 建议的最早重试间隔，仅 RATE_LIMITED 时有意义 */
    private final long retryAfterMs;

    /** 拒绝来源：bucket 或 circuit 名称 */
    private final String source;

    private Admission(AdmissionStatus status, long retryAfterMs, String source) {
        this.status = status;
        this.retryAfterMs = retryAfterMs;
        this.source = source;
    }

    public static Admission admitted() { return ADMITTED; }

    public static Admission notConfigured() { return NOT_CONFIGURED; }

    public static Admission rateLimited(String bucket, long retryAfterMs) {
        return new Admission(AdmissionStatus.RATE_LIMITED, retryAfterMs, bucket);
    }

    public static Admission circuitOpen(String circuit) {
        return new Admission(AdmissionStatus.CIRCUIT_OPEN, 0L, circuit);
    }

    /**
     * 是否允许执行，NOT_CONFIGURED 视为无限制
     */
    public boolean isPermitted() {
        return status == AdmissionStatus.ADMITTED || status == AdmissionStatus.NOT_CONFIGURED;
    }

    public boolean isRateLimited() { return status == AdmissionStatus.RATE_LIMITED; }

    public boolean isCircuitOpen() { return status == AdmissionStatus.CIRCUIT_OPEN; }
}
