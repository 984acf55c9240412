package com.stockscan.cn.model;

/**
 * 模块说明：ExclusionReason（enum）。
 * 主要职责：标记单只证券未产出结论的原因，便于区分“不符合形态”与“数据异常”。
 */
public enum ExclusionReason {
    NONE("none"),
    HISTORY_SHORT("history_short"),
    MISSING_FIELD("missing_field"),
    CODE_PREFIX_EXCLUDED("code_prefix_excluded"),
    SPECIAL_TREATMENT("special_treatment"),
    SEGMENT_NOT_ALLOWED("segment_not_allowed"),
    PRICE_OUT_OF_BAND("price_out_of_band"),
    NOT_AT_SUPPORT("not_at_support"),
    VOLUME_NOT_SHRUNK("volume_not_shrunk"),
    PRICE_NOT_LOW("price_not_low"),
    SCORE_BELOW_MIN("score_below_min"),
    MALFORMED_RECORD("malformed_record");

    private final String label;

    ExclusionReason(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * True when the reason means the bar data itself is unusable rather than simply not matching.
     */
    public boolean isDataProblem() {
        return this == HISTORY_SHORT || this == MISSING_FIELD || this == MALFORMED_RECORD;
    }
}
