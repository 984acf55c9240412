package com.stockscan.cn.strategy;

import com.stockscan.cn.model.ExclusionReason;
import com.stockscan.cn.model.FilterDecision;
import com.stockscan.cn.model.InstrumentIdentity;

import java.util.List;

/**
 * 模块说明：EligibilityFilter（class）。
 * 主要职责：按代码前缀、ST/PT 标记与价格区间做静态准入判断，任一规则不满足即排除。
 * 使用建议：代码前缀规则只在 admitsCode 中实现一次，批量扫描的预过滤也调用它，避免两处规则漂移。
 */
public final class EligibilityFilter {

/**
 * 方法说明：evaluate，负责依次执行四条准入规则并返回首个失败的原因。
 * 处理流程：禁用前缀 → 特殊处理标记 → 板块白名单 → 价格区间（闭区间）；读取过程中的任何异常都按排除处理。
 */
    public FilterDecision evaluate(InstrumentIdentity identity, double latestClose, ScreenProfile profile) {
        try {
            ExclusionReason codeReason = codeRule(identity.code, profile);
            if (codeReason == ExclusionReason.CODE_PREFIX_EXCLUDED) {
                return FilterDecision.reject(codeReason);
            }
            if (hasSpecialTreatmentMarker(identity.name, profile.specialMarkers)) {
                return FilterDecision.reject(ExclusionReason.SPECIAL_TREATMENT);
            }
            if (codeReason == ExclusionReason.SEGMENT_NOT_ALLOWED) {
                return FilterDecision.reject(codeReason);
            }
            if (!Double.isFinite(latestClose) || latestClose < profile.priceMin || latestClose > profile.priceMax) {
                return FilterDecision.reject(ExclusionReason.PRICE_OUT_OF_BAND);
            }
            return FilterDecision.pass();
        } catch (RuntimeException e) {
            return FilterDecision.reject(ExclusionReason.MALFORMED_RECORD);
        }
    }

    public boolean isEligible(InstrumentIdentity identity, double latestClose, ScreenProfile profile) {
        return evaluate(identity, latestClose, profile).passed;
    }

/**
 * 方法说明：admitsCode，负责只根据代码前缀判断是否值得加载行情文件。
 * 处理流程：等价于准入规则 1 与规则 3；名称与价格规则需要加载数据后才能判断。
 */
    public boolean admitsCode(String code, ScreenProfile profile) {
        try {
            return codeRule(InstrumentIdentity.padCode(code), profile) == ExclusionReason.NONE;
        } catch (RuntimeException e) {
            return false;
        }
    }

    private ExclusionReason codeRule(String code, ScreenProfile profile) {
        if (startsWithAny(code, profile.deniedPrefixes)) {
            return ExclusionReason.CODE_PREFIX_EXCLUDED;
        }
        if (!profile.allowedPrefixes.isEmpty() && !startsWithAny(code, profile.allowedPrefixes)) {
            return ExclusionReason.SEGMENT_NOT_ALLOWED;
        }
        return ExclusionReason.NONE;
    }

    private boolean hasSpecialTreatmentMarker(String name, List<String> markers) {
        if (name == null || name.isEmpty()) {
            return false;
        }
        for (String marker : markers) {
            if (name.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    private boolean startsWithAny(String code, List<String> prefixes) {
        for (String prefix : prefixes) {
            if (code.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
