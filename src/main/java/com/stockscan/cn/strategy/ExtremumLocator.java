package com.stockscan.cn.strategy;

import com.stockscan.cn.model.BarDaily;
import com.stockscan.cn.model.BarSeries;

/**
 * 模块说明：ExtremumLocator（class）。
 * 主要职责：在末尾窗口内定位天量日（起涨日）与收盘价的最低/最高点。
 */
public final class ExtremumLocator {

/**
 * 方法说明：locate，负责在两个末尾窗口上分别求成交量最大日与收盘价极值。
 * 处理流程：窗口从最新一根 K 线向前计数，超过序列长度时截断到序列起点；成交量并列时取时间上最早的一根。
 */
    public Extrema locate(BarSeries series, int volumeLookback, int priceLookback) {
        if (series == null || series.isEmpty()) {
            throw new IllegalArgumentException("empty bar series");
        }
        int size = series.size();

        int volumeStart = series.tailStart(volumeLookback);
        int maxIndex = volumeStart;
        double maxVolume = series.get(volumeStart).volume;
        for (int i = volumeStart + 1; i < size; i++) {
            double volume = series.get(i).volume;
            if (volume > maxVolume) {
                maxVolume = volume;
                maxIndex = i;
            }
        }

        int priceStart = series.tailStart(priceLookback);
        double floor = Double.POSITIVE_INFINITY;
        double ceiling = Double.NEGATIVE_INFINITY;
        for (int i = priceStart; i < size; i++) {
            BarDaily bar = series.get(i);
            floor = Math.min(floor, bar.close);
            ceiling = Math.max(ceiling, bar.close);
        }
        return new Extrema(maxIndex, maxVolume, floor, ceiling);
    }

    public Extrema locate(BarSeries series, ScreenProfile profile) {
        return locate(series, profile.volumePeriod, profile.pricePeriod);
    }
}
