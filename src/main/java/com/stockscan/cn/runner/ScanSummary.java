package com.stockscan.cn.runner;

import com.stockscan.cn.model.ExclusionReason;
import com.stockscan.cn.model.InstrumentScanResult;
import com.stockscan.cn.model.ProfileType;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * 模块说明：ScanSummary（class）。
 * 主要职责：汇总一次扫描的文件数、命中数、排除原因分布与失败数，用于日志与运行摘要。
 * 使用建议：只在汇总线程中累加，不在扫描线程间共享。
 */
public final class ScanSummary {
    public final ProfileType profile;
    int totalFiles;
    int prefiltered;
    int scanned;
    int matched;
    int failed;
    long elapsedMs;
    private final EnumMap<ExclusionReason, Integer> exclusionCounts = new EnumMap<>(ExclusionReason.class);

    ScanSummary(ProfileType profile) {
        this.profile = profile;
        for (ExclusionReason reason : ExclusionReason.values()) {
            exclusionCounts.put(reason, 0);
        }
    }

    void record(InstrumentScanResult result) {
        scanned++;
        if (result.status == InstrumentScanResult.Status.MATCHED) {
            matched++;
            return;
        }
        if (result.status == InstrumentScanResult.Status.FAILED) {
            failed++;
        }
        exclusionCounts.merge(result.reason, 1, Integer::sum);
    }

    void recordPrefiltered() {
        prefiltered++;
    }

    public int totalFiles() {
        return totalFiles;
    }

    public int prefiltered() {
        return prefiltered;
    }

    public int scanned() {
        return scanned;
    }

    public int matched() {
        return matched;
    }

    public int failed() {
        return failed;
    }

    public long elapsedMs() {
        return elapsedMs;
    }

    public int excluded(ExclusionReason reason) {
        return exclusionCounts.getOrDefault(reason, 0);
    }

    public Map<ExclusionReason, Integer> exclusionCounts() {
        return Map.copyOf(exclusionCounts);
    }

    public String toLogLine() {
        return String.format(
                Locale.US,
                "profile=%s files=%d prefiltered=%d scanned=%d matched=%d failed=%d history_short=%d ineligible=%d no_pattern=%d elapsed=%.1fs",
                profile,
                totalFiles,
                prefiltered,
                scanned,
                matched,
                failed,
                excluded(ExclusionReason.HISTORY_SHORT),
                excluded(ExclusionReason.CODE_PREFIX_EXCLUDED)
                        + excluded(ExclusionReason.SPECIAL_TREATMENT)
                        + excluded(ExclusionReason.SEGMENT_NOT_ALLOWED)
                        + excluded(ExclusionReason.PRICE_OUT_OF_BAND),
                excluded(ExclusionReason.NOT_AT_SUPPORT)
                        + excluded(ExclusionReason.VOLUME_NOT_SHRUNK)
                        + excluded(ExclusionReason.PRICE_NOT_LOW)
                        + excluded(ExclusionReason.SCORE_BELOW_MIN),
                elapsedMs / 1000.0
        );
    }
}
