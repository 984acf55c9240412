package com.stockscan.cn.output;

import com.stockscan.cn.model.ProfileType;
import com.stockscan.cn.model.RankedResultSet;
import com.stockscan.cn.model.Verdict;
import com.stockscan.cn.runner.ScanSummary;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 模块说明：ConsoleReport（class）。
 * 主要职责：把结果集渲染为控制台表格与一行扫描摘要。
 */
public final class ConsoleReport {

    public String render(RankedResultSet ranked, ScanSummary summary, Path savedTo) {
        StringBuilder sb = new StringBuilder(1024);
        if (ranked.isEmpty()) {
            sb.append("扫描完成：没有股票满足筛选条件。\n");
        } else {
            sb.append("--- 筛选结果 ---\n");
            appendTable(sb, ResultCsvWriter.columnsFor(ranked.profile), rows(ranked));
            sb.append("\n");
            if (ranked.profile == ProfileType.SUPPORT_RETEST) {
                sb.append("复盘完成，选出 ").append(ranked.size()).append(" 只潜力股");
                if (ranked.isTruncated()) {
                    sb.append("（共 ").append(ranked.candidateCount).append(" 只符合条件）");
                }
                sb.append("。\n");
            } else {
                sb.append("扫描完成，共找到 ").append(ranked.size()).append(" 只满足条件的股票。\n");
            }
        }
        if (summary != null) {
            sb.append("扫描统计: ").append(summary.toLogLine()).append("\n");
        }
        if (savedTo != null) {
            sb.append("结果已保存到: ").append(savedTo).append("\n");
        }
        return sb.toString();
    }

    private List<String[]> rows(RankedResultSet ranked) {
        List<String[]> rows = new ArrayList<>(ranked.size());
        for (Verdict verdict : ranked.verdicts) {
            rows.add(ResultCsvWriter.toRow(verdict));
        }
        return rows;
    }

    private void appendTable(StringBuilder sb, String[] header, List<String[]> rows) {
        int[] widths = new int[header.length];
        for (int i = 0; i < header.length; i++) {
            widths[i] = displayWidth(header[i]);
        }
        for (String[] row : rows) {
            for (int i = 0; i < header.length && i < row.length; i++) {
                widths[i] = Math.max(widths[i], displayWidth(row[i]));
            }
        }
        appendLine(sb, header, widths);
        for (String[] row : rows) {
            appendLine(sb, row, widths);
        }
    }

    private void appendLine(StringBuilder sb, String[] cells, int[] widths) {
        for (int i = 0; i < widths.length; i++) {
            String cell = i < cells.length && cells[i] != null ? cells[i] : "";
            if (i > 0) {
                sb.append("  ");
            }
            sb.append(" ".repeat(Math.max(0, widths[i] - displayWidth(cell)))).append(cell);
        }
        sb.append("\n");
    }

    // CJK characters take two terminal columns.
    static int displayWidth(String text) {
        if (text == null) {
            return 0;
        }
        int width = 0;
        for (int i = 0; i < text.length(); i++) {
            width += text.charAt(i) >= 0x2E80 ? 2 : 1;
        }
        return width;
    }
}
