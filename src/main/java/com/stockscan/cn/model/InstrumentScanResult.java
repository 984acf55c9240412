package com.stockscan.cn.model;

/**
 * 模块说明：InstrumentScanResult（class）。
 * 主要职责：单只证券的扫描结果，三态之一：命中（带结论）、排除（带原因）、失败（带原因与异常信息）。
 */
public final class InstrumentScanResult {
    public enum Status {
        MATCHED,
        EXCLUDED,
        FAILED
    }

    public final String code;
    public final Status status;
    public final Verdict verdict;
    public final ExclusionReason reason;
    public final String error;
    public final int barsCount;

    private InstrumentScanResult(
            String code,
            Status status,
            Verdict verdict,
            ExclusionReason reason,
            String error,
            int barsCount
    ) {
        this.code = code == null ? "" : code;
        this.status = status;
        this.verdict = verdict;
        this.reason = reason == null ? ExclusionReason.NONE : reason;
        this.error = error == null ? "" : error;
        this.barsCount = Math.max(0, barsCount);
    }

    public static InstrumentScanResult matched(Verdict verdict, int barsCount) {
        return new InstrumentScanResult(verdict.code, Status.MATCHED, verdict, ExclusionReason.NONE, null, barsCount);
    }

    public static InstrumentScanResult excluded(String code, ExclusionReason reason, int barsCount) {
        return new InstrumentScanResult(code, Status.EXCLUDED, null, reason, null, barsCount);
    }

    public static InstrumentScanResult failed(String code, ExclusionReason reason, String error, int barsCount) {
        return new InstrumentScanResult(code, Status.FAILED, null, reason, error, barsCount);
    }

    public static InstrumentScanResult failed(String code, Throwable cause) {
        String message = cause == null ? "" : cause.getClass().getSimpleName()
                + (cause.getMessage() == null ? "" : ": " + cause.getMessage());
        return failed(code, ExclusionReason.MALFORMED_RECORD, message, 0);
    }

    public boolean isMatched() {
        return status == Status.MATCHED;
    }
}
