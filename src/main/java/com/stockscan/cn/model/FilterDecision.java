package com.stockscan.cn.model;

/**
 * 模块说明：FilterDecision（class）。
 * 主要职责：承载校验或准入规则的判定结果，失败时只记录首个命中的规则。
 */
public final class FilterDecision {
    private static final FilterDecision PASS = new FilterDecision(true, ExclusionReason.NONE);

    public final boolean passed;
    public final ExclusionReason reason;

    private FilterDecision(boolean passed, ExclusionReason reason) {
        this.passed = passed;
        this.reason = reason == null ? ExclusionReason.NONE : reason;
    }

    public static FilterDecision pass() {
        return PASS;
    }

    public static FilterDecision reject(ExclusionReason reason) {
        return new FilterDecision(false, reason);
    }
}
