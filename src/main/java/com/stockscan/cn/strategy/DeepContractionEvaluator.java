package com.stockscan.cn.strategy;

import com.stockscan.cn.model.BarDaily;
import com.stockscan.cn.model.BarSeries;
import com.stockscan.cn.model.ExclusionReason;
import com.stockscan.cn.model.InstrumentIdentity;
import com.stockscan.cn.model.InstrumentScanResult;
import com.stockscan.cn.model.Verdict;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 模块说明：DeepContractionEvaluator（class）。
 * 主要职责：缩量见底。最新成交量不超过 120 日天量的 3%，且最新收盘价位于 40 日收盘区间底部 3% 以内。
 * 使用建议：只做通过/不通过判断，不打分，结论里保留原始指标供人工复核。
 */
public final class DeepContractionEvaluator implements PatternEvaluator {

    @Override
    public InstrumentScanResult evaluate(
            InstrumentIdentity identity,
            BarSeries series,
            Extrema extrema,
            ScreenProfile profile
    ) {
        BarDaily latest = series.latest();
        double maxVolume = extrema.maxVolume;
        if (latest.volume > maxVolume * profile.volumeShrinkRatio) {
            return InstrumentScanResult.excluded(identity.code, ExclusionReason.VOLUME_NOT_SHRUNK, series.size());
        }

        double lowThreshold = extrema.floorPrice + profile.lowRangeRatio * extrema.priceRange();
        if (latest.close > lowThreshold) {
            return InstrumentScanResult.excluded(identity.code, ExclusionReason.PRICE_NOT_LOW, series.size());
        }

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("low_price", extrema.floorPrice);
        metrics.put("high_price", extrema.ceilingPrice);
        metrics.put("shrink_ratio", maxVolume > 0.0 ? latest.volume / maxVolume : 0.0);

        Verdict verdict = Verdict.builder()
                .code(identity.code)
                .name(identity.name)
                .profile(profile.type)
                .latestClose(latest.close)
                .latestVolume(latest.volume)
                .referencePrice(lowThreshold)
                .referenceVolume(maxVolume)
                .metrics(Map.copyOf(metrics))
                .build();
        return InstrumentScanResult.matched(verdict, series.size());
    }
}
