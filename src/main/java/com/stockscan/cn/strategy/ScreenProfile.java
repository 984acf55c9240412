package com.stockscan.cn.strategy;

import com.stockscan.cn.config.Config;
import com.stockscan.cn.model.ProfileType;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 模块说明：ScreenProfile（class）。
 * 主要职责：一套筛选策略的全部参数（准入规则、窗口长度、阈值与打分梯度），由 ProfileType 选择。
 * 使用建议：两套策略共用同一条流水线，差异只体现在这里的参数与 evaluator() 返回的评估器上。
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class ScreenProfile {
    public final ProfileType type;
    public final int minHistoryBars;
    public final List<String> deniedPrefixes;
    public final List<String> allowedPrefixes;
    public final List<String> specialMarkers;
    public final double priceMin;
    public final double priceMax;
    public final int volumePeriod;
    public final int pricePeriod;
    public final double maxSupportProximity;
    public final double maxVolumeRatio;
    public final int smaPeriod;
    public final int baseScore;
    public final int smaBonus;
    public final int reexpansionBonus;
    public final int minScore;
    public final double volumeShrinkRatio;
    public final double lowRangeRatio;
    /** 0 means unbounded. */
    public final int maxResults;

/**
 * 方法说明：fromConfig，负责按 profile.a.* / profile.b.* 配置键组装策略参数。
 * 处理流程：窗口与最少历史长度做下限保护；B 策略的最少历史长度不低于两个窗口中较长者。
 */
    public static ScreenProfile fromConfig(ProfileType type, Config config) {
        String p = type == ProfileType.SUPPORT_RETEST ? "profile.a." : "profile.b.";
        int volumePeriod = Math.max(1, config.getInt(p + "volume_period"));
        int pricePeriod = Math.max(1, config.getInt(p + "price_period"));
        int smaPeriod = Math.max(1, config.getInt(p + "sma_period", 5));
        int minHistory = Math.max(1, config.getInt(p + "min_history_bars"));
        if (type == ProfileType.DEEP_CONTRACTION) {
            minHistory = Math.max(minHistory, Math.max(volumePeriod, pricePeriod));
        } else {
            minHistory = Math.max(minHistory, Math.max(2, Math.max(volumePeriod, smaPeriod)));
        }
        return ScreenProfile.builder()
                .type(type)
                .minHistoryBars(minHistory)
                .deniedPrefixes(List.copyOf(config.getList(p + "denied_prefixes")))
                .allowedPrefixes(List.copyOf(config.getList(p + "allowed_prefixes")))
                .specialMarkers(List.copyOf(config.getList("eligibility.special_markers")))
                .priceMin(config.getDouble(p + "price.min"))
                .priceMax(config.getDouble(p + "price.max"))
                .volumePeriod(volumePeriod)
                .pricePeriod(pricePeriod)
                .maxSupportProximity(config.getDouble(p + "support.max_proximity", 0.03))
                .maxVolumeRatio(config.getDouble(p + "volume.max_ratio", 0.5))
                .smaPeriod(smaPeriod)
                .baseScore(config.getInt(p + "score.base", 70))
                .smaBonus(config.getInt(p + "score.sma_bonus", 20))
                .reexpansionBonus(config.getInt(p + "score.reexpansion_bonus", 10))
                .minScore(config.getInt(p + "score.min", 70))
                .volumeShrinkRatio(config.getDouble(p + "volume.shrink_ratio", 0.03))
                .lowRangeRatio(config.getDouble(p + "price.low_range_ratio", 0.03))
                .maxResults(Math.max(0, config.getInt(p + "top_n")))
                .build();
    }

    public PatternEvaluator evaluator() {
        return type == ProfileType.SUPPORT_RETEST
                ? new SupportRetestEvaluator()
                : new DeepContractionEvaluator();
    }

/**
 * 方法说明：lookbackBars，负责给出评估时实际读取的末尾 K 线数量。
 * 处理流程：A 策略取成交量窗口、价格窗口与均线周期中的最大者，且至少包含前一根 K 线；B 策略取两个窗口中的较长者。
 */
    public int lookbackBars() {
        if (type == ProfileType.SUPPORT_RETEST) {
            return Math.max(2, Math.max(smaPeriod, Math.max(volumePeriod, pricePeriod)));
        }
        return Math.max(volumePeriod, pricePeriod);
    }

    public boolean isBounded() {
        return maxResults > 0;
    }
}
