package com.stockscan.cn.strategy;

import com.stockscan.cn.model.BarDaily;
import com.stockscan.cn.model.BarSeries;
import com.stockscan.cn.model.ExclusionReason;
import com.stockscan.cn.model.InstrumentIdentity;
import com.stockscan.cn.model.InstrumentScanResult;
import com.stockscan.cn.model.SignalTier;
import com.stockscan.cn.model.Verdict;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 模块说明：SupportRetestEvaluator（class）。
 * 主要职责：龙回头缩量回踩。以近 20 日天量日的开盘价作为起涨支撑位，判断最新价是否缩量回踩到支撑附近。
 * 使用建议：基础条件（贴近支撑、量能减半）同时满足才有结论，均线与放量只负责在 70 分基础上加分。
 */
public final class SupportRetestEvaluator implements PatternEvaluator {

/**
 * 方法说明：evaluate，负责计算支撑距离、缩量比例并按梯度打分。
 * 处理流程：支撑价或起涨日成交量不为正时无法计算比例，按数据异常返回；其余不满足条件的情况按排除返回。
 * 维护提示：最低出结论分数 minScore 默认等于基础分，因此实际门槛就是两条基础条件。
 */
    @Override
    public InstrumentScanResult evaluate(
            InstrumentIdentity identity,
            BarSeries series,
            Extrema extrema,
            ScreenProfile profile
    ) {
        BarDaily latest = series.latest();
        BarDaily launch = series.get(extrema.maxVolumeIndex);
        double support = launch.open;
        double launchVolume = launch.volume;
        if (!(support > 0.0)) {
            return InstrumentScanResult.failed(identity.code, ExclusionReason.MALFORMED_RECORD,
                    "support price is not positive: " + support, series.size());
        }
        if (!(launchVolume > 0.0)) {
            return InstrumentScanResult.failed(identity.code, ExclusionReason.MALFORMED_RECORD,
                    "reference volume is not positive: " + launchVolume, series.size());
        }

        double proximity = Math.abs(latest.close - support) / support;
        if (proximity > profile.maxSupportProximity) {
            return InstrumentScanResult.excluded(identity.code, ExclusionReason.NOT_AT_SUPPORT, series.size());
        }
        double volumeRatio = latest.volume / launchVolume;
        if (volumeRatio >= profile.maxVolumeRatio) {
            return InstrumentScanResult.excluded(identity.code, ExclusionReason.VOLUME_NOT_SHRUNK, series.size());
        }

        int score = profile.baseScore;
        SignalTier tier = SignalTier.PROBE;
        double sma = smaClose(series.tail(profile.volumePeriod), profile.smaPeriod);
        boolean aboveSma = latest.close > sma;
        if (aboveSma) {
            score += profile.smaBonus;
            tier = SignalTier.FOCUS;
        }
        BarDaily previous = series.previous();
        boolean reexpanding = previous != null && latest.volume > previous.volume;
        if (reexpanding) {
            score += profile.reexpansionBonus;
            tier = SignalTier.CONVICTION;
        }
        if (score < profile.minScore) {
            return InstrumentScanResult.excluded(identity.code, ExclusionReason.SCORE_BELOW_MIN, series.size());
        }

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("support_proximity", proximity);
        metrics.put("volume_ratio", volumeRatio);
        metrics.put("sma", sma);
        metrics.put("above_sma", aboveSma);
        metrics.put("volume_reexpanding", reexpanding);
        metrics.put("launch_date", launch.tradeDate.toString());

        Verdict verdict = Verdict.builder()
                .code(identity.code)
                .name(identity.name)
                .profile(profile.type)
                .latestClose(latest.close)
                .latestVolume(latest.volume)
                .referencePrice(round2(support))
                .referenceVolume(launchVolume)
                .score(score)
                .tier(tier)
                .metrics(Map.copyOf(metrics))
                .build();
        return InstrumentScanResult.matched(verdict, series.size());
    }

    // Simple moving average of the last `period` closes in the window, latest bar included.
    private double smaClose(List<BarDaily> window, int period) {
        int n = Math.min(period, window.size());
        double sum = 0.0;
        for (int i = window.size() - n; i < window.size(); i++) {
            sum += window.get(i).close;
        }
        return sum / n;
    }

    // Rounds the exact binary value, ties to even: 10.125 -> 10.12, 2.675 -> 2.67.
    static double round2(double value) {
        return new BigDecimal(value).setScale(2, RoundingMode.HALF_EVEN).doubleValue();
    }
}
