package com.stockscan.cn.data;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvException;
import com.stockscan.cn.model.InstrumentIdentity;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only code to display-name lookup, loaded once per run from a {@code code,name} CSV and
 * shared by all scan tasks.
 */
public final class StockNameDirectory {
    private static final Logger LOG = LogManager.getLogger(StockNameDirectory.class);

    private final Map<String, String> names;
    private final String placeholder;

    public StockNameDirectory(Map<String, String> names, String placeholder) {
        Map<String, String> padded = new LinkedHashMap<>();
        if (names != null) {
            names.forEach((code, name) -> padded.put(InstrumentIdentity.padCode(code), name == null ? "" : name.trim()));
        }
        this.names = Collections.unmodifiableMap(padded);
        this.placeholder = placeholder == null ? "" : placeholder;
    }

    public static StockNameDirectory empty(String placeholder) {
        return new StockNameDirectory(Map.of(), placeholder);
    }

/**
 * 方法说明：load，负责读取股票名称表（首行为表头，取前两列为代码与名称）。
 * 处理流程：文件缺失或读取失败时记录告警并返回空表，所有证券将使用占位名称，不中断扫描。
 */
    public static StockNameDirectory load(Path file, String placeholder) {
        if (file == null || !Files.isRegularFile(file)) {
            LOG.warn("stock names file not found: {}, names fall back to '{}'", file, placeholder);
            return empty(placeholder);
        }
        Map<String, String> names = new LinkedHashMap<>();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVReader csv = new CSVReaderBuilder(reader).withSkipLines(1).build()) {
            List<String[]> rows = csv.readAll();
            for (String[] row : rows) {
                if (row.length < 2 || row[0] == null || row[0].trim().isEmpty()) {
                    continue;
                }
                names.put(row[0].trim(), row[1]);
            }
        } catch (IOException | CsvException e) {
            LOG.warn("failed to load stock names from {}: {}", file, e.getMessage());
            return empty(placeholder);
        }
        StockNameDirectory directory = new StockNameDirectory(names, placeholder);
        LOG.info("loaded {} stock name records from {}", directory.size(), file);
        return directory;
    }

    public String nameOf(String code) {
        String name = names.get(InstrumentIdentity.padCode(code));
        return name == null || name.isEmpty() ? placeholder : name;
    }

    public InstrumentIdentity identityOf(String code) {
        return new InstrumentIdentity(code, nameOf(code));
    }

    public int size() {
        return names.size();
    }
}
