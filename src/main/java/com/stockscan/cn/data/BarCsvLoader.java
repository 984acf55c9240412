package com.stockscan.cn.data;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvException;
import com.stockscan.cn.config.Config;
import com.stockscan.cn.model.BarDaily;
import com.stockscan.cn.model.BarSeries;
import com.stockscan.cn.model.InstrumentIdentity;
import com.stockscan.cn.runner.BatchInputException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.TreeMap;

/**
 * 模块说明：BarCsvLoader（class）。
 * 主要职责：发现 stock_data 目录下的行情文件，并把单个 CSV 解析为按日期升序、去重后的日线序列。
 * 使用建议：列名通过 csv.column.* 配置，默认对应东方财富导出的中文表头。
 */
public final class BarCsvLoader {
    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("yyyy/M/d"),
            DateTimeFormatter.BASIC_ISO_DATE
    );

    private final String dateColumn;
    private final String openColumn;
    private final String closeColumn;
    private final String volumeColumn;

    public BarCsvLoader(Config config) {
        this.dateColumn = config.getString("csv.column.date");
        this.openColumn = config.getString("csv.column.open");
        this.closeColumn = config.getString("csv.column.close");
        this.volumeColumn = config.getString("csv.column.volume");
    }

/**
 * 方法说明：listInstrumentFiles，负责列出数据目录下的全部 *.csv 文件。
 * 处理流程：目录不存在或没有任何 CSV 时抛出 BatchInputException；结果按文件名排序，保证每次运行的提交顺序一致。
 */
    public List<Path> listInstrumentFiles(Path dataDir) throws BatchInputException {
        if (dataDir == null || !Files.isDirectory(dataDir)) {
            throw new BatchInputException("Directory '" + dataDir + "' not found.");
        }
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dataDir, "*.csv")) {
            for (Path file : stream) {
                if (Files.isRegularFile(file)) {
                    files.add(file);
                }
            }
        } catch (IOException e) {
            throw new BatchInputException("failed to list " + dataDir + ": " + e.getMessage(), e);
        }
        if (files.isEmpty()) {
            throw new BatchInputException("No CSV files found in " + dataDir);
        }
        files.sort(Comparator.comparing(p -> p.getFileName().toString()));
        return files;
    }

    /**
     * Six-digit code derived from the file name, e.g. {@code 1.csv -> 000001}.
     */
    public static String codeOf(Path file) {
        String fileName = file.getFileName().toString();
        int dot = fileName.indexOf('.');
        return InstrumentIdentity.padCode(dot >= 0 ? fileName.substring(0, dot) : fileName);
    }

/**
 * 方法说明：load，负责读取并解析单个行情文件。
 * 处理流程：缺少必需列时抛出 IllegalArgumentException；数值无法解析时抛出 NumberFormatException；
 * 空白数值记为 NaN，交由序列校验判定为字段缺失；同一日期出现多次时以最后一行为准。
 */
    public BarSeries load(Path file) throws IOException {
        String code = codeOf(file);
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVReader csv = new CSVReaderBuilder(reader).build()) {
            List<String[]> rows = csv.readAll();
            if (rows.isEmpty()) {
                return new BarSeries(code, List.of());
            }
            String[] header = rows.get(0);
            int dateIdx = requireColumn(header, dateColumn);
            int openIdx = requireColumn(header, openColumn);
            int closeIdx = requireColumn(header, closeColumn);
            int volumeIdx = requireColumn(header, volumeColumn);

            TreeMap<LocalDate, BarDaily> byDate = new TreeMap<>();
            for (int i = 1; i < rows.size(); i++) {
                String[] cols = rows.get(i);
                if (isBlankRow(cols)) {
                    continue;
                }
                LocalDate date = parseDate(cell(cols, dateIdx));
                byDate.put(date, new BarDaily(
                        code,
                        date,
                        parseNumber(cell(cols, openIdx)),
                        parseNumber(cell(cols, closeIdx)),
                        parseNumber(cell(cols, volumeIdx))
                ));
            }
            return new BarSeries(code, new ArrayList<>(byDate.values()));
        } catch (CsvException e) {
            throw new IOException("invalid csv " + file.getFileName() + ": " + e.getMessage(), e);
        }
    }

    private int requireColumn(String[] header, String name) {
        for (int i = 0; i < header.length; i++) {
            if (name.equals(stripBom(header[i]).trim())) {
                return i;
            }
        }
        throw new IllegalArgumentException("missing expected column: " + name);
    }

    private static String stripBom(String raw) {
        if (raw != null && !raw.isEmpty() && raw.charAt(0) == '\uFEFF') {
            return raw.substring(1);
        }
        return raw == null ? "" : raw;
    }

    private static boolean isBlankRow(String[] cols) {
        for (String col : cols) {
            if (col != null && !col.trim().isEmpty()) {
                return false;
            }
        }
        return true;
    }

    private static String cell(String[] cols, int idx) {
        return idx < cols.length && cols[idx] != null ? cols[idx].trim() : "";
    }

    private static LocalDate parseDate(String raw) {
        String text = raw.length() > 10 ? raw.substring(0, 10).trim() : raw;
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return LocalDate.parse(text, format);
            } catch (DateTimeParseException ignored) {
                // try next format
            }
        }
        throw new IllegalArgumentException("unparsable date: " + raw);
    }

    private static double parseNumber(String raw) {
        if (raw.isEmpty() || "nan".equals(raw.toLowerCase(Locale.ROOT))) {
            return Double.NaN;
        }
        return Double.parseDouble(raw.replace(",", ""));
    }
}
