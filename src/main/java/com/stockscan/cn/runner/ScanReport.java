package com.stockscan.cn.runner;

import com.stockscan.cn.model.InstrumentScanResult;
import com.stockscan.cn.model.RankedResultSet;

import java.util.List;

/**
 * Everything one run produced: the ranked set, the per-instrument results in file order, and counters.
 */
public final class ScanReport {
    public final RankedResultSet ranked;
    public final List<InstrumentScanResult> results;
    public final ScanSummary summary;

    ScanReport(RankedResultSet ranked, List<InstrumentScanResult> results, ScanSummary summary) {
        this.ranked = ranked;
        this.results = results == null ? List.of() : List.copyOf(results);
        this.summary = summary;
    }
}
