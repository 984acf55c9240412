package com.stockscan.cn.strategy;

import com.stockscan.cn.model.BarSeries;
import com.stockscan.cn.model.InstrumentIdentity;
import com.stockscan.cn.model.InstrumentScanResult;

/**
 * Scores one validated, eligible series against a pattern. Implementations are stateless.
 */
public interface PatternEvaluator {

    InstrumentScanResult evaluate(
            InstrumentIdentity identity,
            BarSeries series,
            Extrema extrema,
            ScreenProfile profile
    );
}
