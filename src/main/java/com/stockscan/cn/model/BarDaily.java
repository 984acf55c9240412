package com.stockscan.cn.model;

import java.time.LocalDate;

/**
 * 模块说明：BarDaily（class）。
 * 主要职责：单个交易日的开盘、收盘与成交量快照。
 */
public final class BarDaily {
    public final String code;
    public final LocalDate tradeDate;
    public final double open;
    public final double close;
    public final double volume;

    public BarDaily(String code, LocalDate tradeDate, double open, double close, double volume) {
        this.code = code;
        this.tradeDate = tradeDate;
        this.open = open;
        this.close = close;
        this.volume = volume;
    }
}
