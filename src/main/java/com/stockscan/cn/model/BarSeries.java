package com.stockscan.cn.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Read-only daily history of one instrument, ascending by trade date without duplicates.
 */
public final class BarSeries {
    private final String code;
    private final List<BarDaily> bars;

    public BarSeries(String code, List<BarDaily> bars) {
        this.code = code == null ? "" : code;
        this.bars = bars == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(bars));
    }

    public String code() {
        return code;
    }

    public int size() {
        return bars.size();
    }

    public boolean isEmpty() {
        return bars.isEmpty();
    }

    public BarDaily get(int index) {
        return bars.get(index);
    }

    public BarDaily latest() {
        return bars.get(bars.size() - 1);
    }

    /**
     * Bar just before the latest one, or null when the series has a single bar.
     */
    public BarDaily previous() {
        return bars.size() < 2 ? null : bars.get(bars.size() - 2);
    }

    /**
     * Index of the first bar of a trailing window of {@code n} bars; clamped to the series start.
     */
    public int tailStart(int n) {
        return Math.max(0, bars.size() - Math.max(0, n));
    }

    public List<BarDaily> tail(int n) {
        return bars.subList(tailStart(n), bars.size());
    }

    public List<BarDaily> bars() {
        return bars;
    }
}
