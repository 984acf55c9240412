package com.stockscan.cn.output;

import com.opencsv.CSVWriter;
import com.opencsv.ICSVWriter;
import com.stockscan.cn.model.ProfileType;
import com.stockscan.cn.model.RankedResultSet;
import com.stockscan.cn.model.Verdict;

import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

/**
 * 模块说明：ResultCsvWriter（class）。
 * 主要职责：把结果集写入按日期分目录的 CSV 文件（UTF-8 带 BOM，便于 Excel 直接打开中文）。
 * 使用建议：两套策略的列集合与目录格式固定，修改前需确认下游读取脚本。
 */
public final class ResultCsvWriter {
    static final String[] SUPPORT_RETEST_COLUMNS = {
            "code", "latest_close", "support_price", "signal_score", "operation_advice", "name"
    };
    static final String[] DEEP_CONTRACTION_COLUMNS = {
            "Code", "Name", "Latest_Close", "Latest_Volume", "Max_Volume_120d", "Low_Price_40d_Threshold"
    };

    private static final DateTimeFormatter FILE_TS = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final DateTimeFormatter MONTH_DIR_A = DateTimeFormatter.ofPattern("yyyy-MM");
    private static final DateTimeFormatter MONTH_DIR_B = DateTimeFormatter.ofPattern("yyyy/MM");

    private final Path outputsDir;

    public ResultCsvWriter(Path outputsDir) {
        this.outputsDir = outputsDir;
    }

/**
 * 方法说明：resolveOutputPath，负责生成本次运行的输出文件路径。
 * 处理流程：A 策略写入 yyyy-MM 目录，B 策略写入 yyyy/MM 两级目录，文件名带运行时间戳。
 */
    public Path resolveOutputPath(ProfileType profile, ZonedDateTime now) {
        DateTimeFormatter dirFormat = profile == ProfileType.SUPPORT_RETEST ? MONTH_DIR_A : MONTH_DIR_B;
        String fileName = profile.outputPrefix() + "_" + now.format(FILE_TS) + ".csv";
        return outputsDir.resolve(now.format(dirFormat)).resolve(fileName);
    }

/**
 * 方法说明：write，负责写出表头与全部结果行。
 * 处理流程：结果为空时仍写出只有表头的文件；父目录不存在时自动创建。
 */
    public Path write(RankedResultSet ranked, ZonedDateTime now) throws IOException {
        Path out = resolveOutputPath(ranked.profile, now);
        Files.createDirectories(out.getParent());
        try (Writer writer = Files.newBufferedWriter(out, StandardCharsets.UTF_8)) {
            writer.write('\uFEFF');
            try (CSVWriter csv = new CSVWriter(
                    writer,
                    ICSVWriter.DEFAULT_SEPARATOR,
                    ICSVWriter.DEFAULT_QUOTE_CHARACTER,
                    ICSVWriter.DEFAULT_ESCAPE_CHARACTER,
                    ICSVWriter.DEFAULT_LINE_END
            )) {
                csv.writeNext(columnsFor(ranked.profile), false);
                for (Verdict verdict : ranked.verdicts) {
                    csv.writeNext(toRow(verdict), false);
                }
            }
        }
        return out;
    }

    public static String[] columnsFor(ProfileType profile) {
        return profile == ProfileType.SUPPORT_RETEST
                ? SUPPORT_RETEST_COLUMNS.clone()
                : DEEP_CONTRACTION_COLUMNS.clone();
    }

    static String[] toRow(Verdict v) {
        if (v.profile == ProfileType.SUPPORT_RETEST) {
            return new String[]{
                    v.code,
                    number(v.latestClose),
                    number(v.referencePrice),
                    String.valueOf(v.scoreOrZero()),
                    v.adviceOrEmpty(),
                    v.name
            };
        }
        return new String[]{
                v.code,
                v.name,
                number(v.latestClose),
                number(v.latestVolume),
                number(v.referenceVolume),
                number(v.referencePrice)
        };
    }

    // Plain decimal without exponent or trailing zeros: 100000.0 -> 100000, 10.050 -> 10.05.
    static String number(double value) {
        if (!Double.isFinite(value)) {
            return "";
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
