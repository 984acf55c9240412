package com.stockscan.cn.model;

/**
 * 模块说明：SignalTier（enum）。
 * 主要职责：回踩支撑信号的分级与操作建议文案。
 */
public enum SignalTier {
    PROBE("试错性买入 (轻仓)"),
    FOCUS("重点关注 (半仓进攻)"),
    CONVICTION("一击必中 (核心重仓)");

    private final String advice;

    SignalTier(String advice) {
        this.advice = advice;
    }

    public String advice() {
        return advice;
    }
}
