package com.stockscan.cn.runner;

import com.stockscan.cn.model.RankedResultSet;
import com.stockscan.cn.model.Verdict;
import com.stockscan.cn.strategy.ScreenProfile;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 模块说明：ResultRanker（class）。
 * 主要职责：在全部证券评估完成后统一排序并截断，生成最终结果集。
 */
public final class ResultRanker {

/**
 * 方法说明：rank，负责按策略规则排序结论。
 * 处理流程：有分数的结论按分数降序稳定排序（同分保持输入顺序）；无分数的结论按代码升序；
 * 配置了上限时截取前 N 条，否则全部保留。
 */
    public RankedResultSet rank(List<Verdict> verdicts, ScreenProfile profile) {
        List<Verdict> sorted = new ArrayList<>();
        if (verdicts != null) {
            for (Verdict verdict : verdicts) {
                if (verdict != null) {
                    sorted.add(verdict);
                }
            }
        }
        int candidateCount = sorted.size();
        boolean scored = !sorted.isEmpty() && sorted.stream().allMatch(Verdict::isScored);
        if (scored) {
            sorted.sort(Comparator.comparingInt(Verdict::scoreOrZero).reversed());
        } else {
            sorted.sort(Comparator.comparing(v -> v.code));
        }
        if (profile.isBounded() && sorted.size() > profile.maxResults) {
            sorted = new ArrayList<>(sorted.subList(0, profile.maxResults));
        }
        return new RankedResultSet(profile.type, sorted, candidateCount);
    }
}
