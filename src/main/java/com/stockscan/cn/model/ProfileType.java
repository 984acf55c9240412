package com.stockscan.cn.model;

import java.util.Locale;

/**
 * 模块说明：ProfileType（enum）。
 * 主要职责：区分两套筛选策略：A 龙回头缩量回踩、B 缩量见底。
 */
public enum ProfileType {
    SUPPORT_RETEST("A", "support-retest", "dragon_back_strategy"),
    DEEP_CONTRACTION("B", "deep-contraction", "volume_bottom_scan_results");

    private final String tag;
    private final String alias;
    private final String outputPrefix;

    ProfileType(String tag, String alias, String outputPrefix) {
        this.tag = tag;
        this.alias = alias;
        this.outputPrefix = outputPrefix;
    }

    public String tag() {
        return tag;
    }

    public String alias() {
        return alias;
    }

    public String outputPrefix() {
        return outputPrefix;
    }

    /**
     * Accepts the short tag ("A"/"B"), the alias or the enum name, case-insensitively.
     */
    public static ProfileType fromText(String raw) {
        String target = raw == null ? "" : raw.trim();
        for (ProfileType type : values()) {
            if (type.tag.equalsIgnoreCase(target)
                    || type.alias.equalsIgnoreCase(target)
                    || type.name().equalsIgnoreCase(target.replace('-', '_'))) {
                return type;
            }
        }
        throw new IllegalArgumentException("unknown profile: " + raw
                + " (expected one of A, B, support-retest, deep-contraction)");
    }

    @Override
    public String toString() {
        return tag + "/" + alias.toLowerCase(Locale.ROOT);
    }
}
