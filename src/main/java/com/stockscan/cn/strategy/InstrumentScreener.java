package com.stockscan.cn.strategy;

import com.stockscan.cn.model.BarSeries;
import com.stockscan.cn.model.FilterDecision;
import com.stockscan.cn.model.InstrumentIdentity;
import com.stockscan.cn.model.InstrumentScanResult;

/**
 * 模块说明：InstrumentScreener（class）。
 * 主要职责：单只证券的完整判定流程：序列校验 → 准入过滤 → 极值定位 → 形态评估。
 * 使用建议：实例无可变状态，可在多个扫描线程间共享。
 */
public final class InstrumentScreener {
    private final ScreenProfile profile;
    private final BarSeriesValidator validator;
    private final EligibilityFilter eligibilityFilter;
    private final ExtremumLocator extremumLocator;
    private final PatternEvaluator evaluator;

    public InstrumentScreener(ScreenProfile profile) {
        this(profile, new BarSeriesValidator(), new EligibilityFilter(), new ExtremumLocator(), profile.evaluator());
    }

    public InstrumentScreener(
            ScreenProfile profile,
            BarSeriesValidator validator,
            EligibilityFilter eligibilityFilter,
            ExtremumLocator extremumLocator,
            PatternEvaluator evaluator
    ) {
        this.profile = profile;
        this.validator = validator;
        this.eligibilityFilter = eligibilityFilter;
        this.extremumLocator = extremumLocator;
        this.evaluator = evaluator;
    }

/**
 * 方法说明：screen，负责对一只证券执行全部规则并返回三态结果。
 * 处理流程：任一环节不通过即返回排除原因；计算过程中抛出的运行时异常在此收敛为失败结果，不向批量扫描传播。
 */
    public InstrumentScanResult screen(InstrumentIdentity identity, BarSeries series) {
        String code = identity == null ? "" : identity.code;
        int barsCount = series == null ? 0 : series.size();
        try {
            FilterDecision valid = validator.validate(series, profile);
            if (!valid.passed) {
                return InstrumentScanResult.excluded(code, valid.reason, barsCount);
            }
            FilterDecision eligible = eligibilityFilter.evaluate(identity, series.latest().close, profile);
            if (!eligible.passed) {
                return InstrumentScanResult.excluded(code, eligible.reason, barsCount);
            }
            Extrema extrema = extremumLocator.locate(series, profile);
            return evaluator.evaluate(identity, series, extrema, profile);
        } catch (RuntimeException e) {
            return InstrumentScanResult.failed(code, e);
        }
    }

    public ScreenProfile profile() {
        return profile;
    }

    public EligibilityFilter eligibilityFilter() {
        return eligibilityFilter;
    }
}
