package com.stockscan.cn.strategy;

import com.stockscan.cn.model.BarDaily;
import com.stockscan.cn.model.BarSeries;
import com.stockscan.cn.model.ExclusionReason;
import com.stockscan.cn.model.FilterDecision;

/**
 * 模块说明：BarSeriesValidator（class）。
 * 主要职责：在进入形态计算前拦截历史长度不足或字段缺失的日线序列。
 */
public final class BarSeriesValidator {

/**
 * 方法说明：validate，负责检查序列长度与数值字段。
 * 处理流程：长度恰好等于下限时放行；只检查策略窗口内的 K 线，窗口内任一开盘/收盘/成交量为非有限值或负数，
 * 或最新收盘价不为正时判为字段缺失。窗口之外的历史不参与计算，也不参与校验。
 */
    public FilterDecision validate(BarSeries series, ScreenProfile profile) {
        int size = series == null ? 0 : series.size();
        if (size < profile.minHistoryBars) {
            return FilterDecision.reject(ExclusionReason.HISTORY_SHORT);
        }
        for (BarDaily bar : series.tail(profile.lookbackBars())) {
            if (bar == null || bar.tradeDate == null
                    || !isValidField(bar.open)
                    || !isValidField(bar.close)
                    || !isValidField(bar.volume)) {
                return FilterDecision.reject(ExclusionReason.MISSING_FIELD);
            }
        }
        if (series.latest().close <= 0.0) {
            return FilterDecision.reject(ExclusionReason.MISSING_FIELD);
        }
        return FilterDecision.pass();
    }

    private boolean isValidField(double value) {
        return Double.isFinite(value) && value >= 0.0;
    }
}
