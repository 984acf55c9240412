package com.stockscan.cn.runner;

import com.stockscan.cn.config.Config;
import com.stockscan.cn.data.StockNameDirectory;
import com.stockscan.cn.model.BarFixtures;
import com.stockscan.cn.model.ExclusionReason;
import com.stockscan.cn.model.InstrumentScanResult;
import com.stockscan.cn.model.ProfileType;
import com.stockscan.cn.model.Verdict;
import com.stockscan.cn.strategy.ScreenProfile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScanRunnerTest {

    @TempDir
    Path tempDir;

    @Test
    void run_shouldIsolateBadFilesAndRankMatches() throws Exception {
        Path dataDir = prepareUniverse();

        ScanReport report = runner().run(dataDir);

        assertEquals(List.of("000001", "600001"), codes(report));
        ScanSummary summary = report.summary;
        assertEquals(6, summary.totalFiles());
        assertEquals(1, summary.prefiltered());
        assertEquals(5, summary.scanned());
        assertEquals(2, summary.matched());
        assertEquals(1, summary.failed());
        assertEquals(1, summary.excluded(ExclusionReason.SPECIAL_TREATMENT));
        assertEquals(1, summary.excluded(ExclusionReason.HISTORY_SHORT));
        assertEquals(1, summary.excluded(ExclusionReason.MALFORMED_RECORD));
    }

    @Test
    void run_shouldReportFailureForFileWithoutCloseColumn() throws Exception {
        Path dataDir = prepareUniverse();

        ScanReport report = runner().run(dataDir);

        InstrumentScanResult broken = resultFor(report, "600003");
        assertEquals(InstrumentScanResult.Status.FAILED, broken.status);
        assertTrue(broken.error.contains("收盘"));
    }

    @Test
    void run_shouldBeIdempotent() throws Exception {
        Path dataDir = prepareUniverse();
        ScanRunner runner = runner();

        List<Verdict> first = runner.run(dataDir).ranked.verdicts;
        List<Verdict> second = runner.run(dataDir).ranked.verdicts;

        assertEquals(first, second);
    }

    @Test
    void run_missingDirectoryShouldRaiseBatchInputError() {
        assertThrows(BatchInputException.class, () -> runner().run(tempDir.resolve("absent")));
    }

    @Test
    void run_directoryWithoutCsvShouldRaiseBatchInputError() throws IOException {
        Path dataDir = Files.createDirectories(tempDir.resolve("empty"));
        Files.writeString(dataDir.resolve("readme.txt"), "nothing here");

        assertThrows(BatchInputException.class, () -> runner().run(dataDir));
    }

    @Test
    void scanFile_shouldUsePlaceholderNameForUnknownCode() throws Exception {
        Path dataDir = prepareUniverse();

        InstrumentScanResult result = runner().scanFile(dataDir.resolve("1.csv"));

        assertTrue(result.isMatched());
        assertEquals("000001", result.verdict.code);
        assertEquals("未知名称", result.verdict.name);
    }

    private ScanRunner runner() {
        Config config = Config.fromMap(tempDir, Map.of("scan", Map.of("threads", 3)));
        ScreenProfile profile = ScreenProfile.fromConfig(ProfileType.DEEP_CONTRACTION, config);
        StockNameDirectory names = new StockNameDirectory(
                Map.of("600001", "招商轮船", "600002", "*ST海创", "600004", "新股份"),
                "未知名称"
        );
        return new ScanRunner(config, profile, names);
    }

    private Path prepareUniverse() throws IOException {
        Path dataDir = Files.createDirectories(tempDir.resolve("stock_data"));
        BarFixtures.writeCsv(dataDir.resolve("600001.csv"), BarFixtures.deepContraction("600001"));
        BarFixtures.writeCsv(dataDir.resolve("300001.csv"), BarFixtures.deepContraction("300001"));
        BarFixtures.writeCsv(dataDir.resolve("600002.csv"), BarFixtures.deepContraction("600002"));
        BarFixtures.writeCsv(dataDir.resolve("600004.csv"), BarFixtures.flat("600004", 50, 10.0, 1000));
        BarFixtures.writeCsv(dataDir.resolve("1.csv"), BarFixtures.deepContraction("000001"));
        Files.writeString(
                dataDir.resolve("600003.csv"),
                "日期,开盘,成交量\n2025-01-02,10.0,1000\n",
                StandardCharsets.UTF_8
        );
        return dataDir;
    }

    private static InstrumentScanResult resultFor(ScanReport report, String code) {
        for (InstrumentScanResult result : report.results) {
            if (code.equals(result.code)) {
                return result;
            }
        }
        throw new AssertionError("no result for " + code);
    }

    private static List<String> codes(ScanReport report) {
        List<String> codes = new ArrayList<>();
        for (Verdict verdict : report.ranked.verdicts) {
            codes.add(verdict.code);
        }
        return codes;
    }
}
