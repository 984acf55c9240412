package com.stockscan.cn.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * A passing instrument. {@code referencePrice}/{@code referenceVolume} hold the support open and
 * launch-day volume for support-retest, or the low-band threshold and 120-day max volume for
 * deep-contraction. Score and tier are only set by scored profiles.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class Verdict {
    public final String code;
    public final String name;
    public final ProfileType profile;
    public final double latestClose;
    public final double latestVolume;
    public final double referencePrice;
    public final double referenceVolume;
    public final Integer score;
    public final SignalTier tier;
    public final Map<String, Object> metrics;

    public boolean isScored() {
        return score != null;
    }

    public int scoreOrZero() {
        return score == null ? 0 : score;
    }

    public String adviceOrEmpty() {
        return tier == null ? "" : tier.advice();
    }
}
