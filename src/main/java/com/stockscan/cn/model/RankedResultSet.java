package com.stockscan.cn.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 模块说明：RankedResultSet（class）。
 * 主要职责：一次扫描最终输出的有序结论列表，创建后不可修改。
 */
public final class RankedResultSet {
    public final ProfileType profile;
    public final List<Verdict> verdicts;
    public final int candidateCount;

    public RankedResultSet(ProfileType profile, List<Verdict> verdicts, int candidateCount) {
        this.profile = profile;
        this.verdicts = verdicts == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(verdicts));
        this.candidateCount = Math.max(this.verdicts.size(), candidateCount);
    }

    public int size() {
        return verdicts.size();
    }

    public boolean isEmpty() {
        return verdicts.isEmpty();
    }

    public boolean isTruncated() {
        return candidateCount > verdicts.size();
    }
}
