package com.stockscan.cn.data;

import com.stockscan.cn.config.Config;
import com.stockscan.cn.model.BarSeries;
import com.stockscan.cn.runner.BatchInputException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BarCsvLoaderTest {

    @TempDir
    Path tempDir;

    private BarCsvLoader loader() {
        return new BarCsvLoader(Config.fromMap(tempDir, Map.of()));
    }

    @Test
    void load_shouldSortByDateAndKeepLastDuplicate() throws Exception {
        Path file = write("600000.csv",
                "\uFEFF日期,股票代码,开盘,收盘,最高,最低,成交量\n"
                        + "2025-01-06,600000,10.2,10.3,10.5,10.1,3000\n"
                        + "2025-01-02,600000,10.0,10.1,10.2,9.9,1000\n"
                        + "2025-01-03,600000,10.1,10.2,10.3,10.0,2000\n"
                        + "2025-01-03,600000,10.1,10.25,10.3,10.0,2500\n");

        BarSeries series = loader().load(file);

        assertEquals("600000", series.code());
        assertEquals(3, series.size());
        assertEquals(LocalDate.of(2025, 1, 2), series.get(0).tradeDate);
        assertEquals(10.25, series.get(1).close, 1e-9);
        assertEquals(2500.0, series.get(1).volume, 1e-9);
        assertEquals(LocalDate.of(2025, 1, 6), series.latest().tradeDate);
    }

    @Test
    void load_shouldAcceptSlashAndCompactDates() throws Exception {
        Path file = write("1.csv",
                "日期,开盘,收盘,成交量\n"
                        + "2025/1/2,10,10.1,1000\n"
                        + "20250103,10.1,10.2,2000\n");

        BarSeries series = loader().load(file);

        assertEquals("000001", series.code());
        assertEquals(LocalDate.of(2025, 1, 3), series.latest().tradeDate);
    }

    @Test
    void load_shouldMapBlankAndNanNumbersToNaN() throws Exception {
        Path file = write("600000.csv",
                "日期,开盘,收盘,成交量\n"
                        + "2025-01-02,10.0,,1000\n"
                        + "2025-01-03,10.0,10.1,nan\n");

        BarSeries series = loader().load(file);

        assertTrue(Double.isNaN(series.get(0).close));
        assertTrue(Double.isNaN(series.get(1).volume));
    }

    @Test
    void load_shouldRejectFileWithoutVolumeColumn() throws Exception {
        Path file = write("600000.csv", "日期,开盘,收盘\n2025-01-02,10.0,10.1\n");

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class, () -> loader().load(file));
        assertTrue(error.getMessage().contains("成交量"));
    }

    @Test
    void load_shouldHonourConfiguredColumnNames() throws Exception {
        Config config = Config.fromMap(tempDir, Map.of("csv", Map.of("column", Map.of(
                "date", "date", "open", "open", "close", "close", "volume", "volume"))));
        Path file = write("600000.csv", "date,open,close,volume\n2025-01-02,10.0,10.1,1000\n");

        BarSeries series = new BarCsvLoader(config).load(file);

        assertEquals(1, series.size());
        assertEquals(10.1, series.latest().close, 1e-9);
    }

    @Test
    void listInstrumentFiles_shouldReturnCsvFilesSortedByName() throws Exception {
        write("600001.csv", "日期\n");
        write("000002.csv", "日期\n");
        write("notes.txt", "x");

        List<Path> files = loader().listInstrumentFiles(tempDir);

        assertEquals(2, files.size());
        assertEquals("000002.csv", files.get(0).getFileName().toString());
        assertEquals("600001.csv", files.get(1).getFileName().toString());
    }

    @Test
    void listInstrumentFiles_shouldFailForMissingDirectory() {
        BatchInputException error = assertThrows(
                BatchInputException.class,
                () -> loader().listInstrumentFiles(tempDir.resolve("stock_data"))
        );
        assertTrue(error.getMessage().contains("not found"));
    }

    @Test
    void codeOf_shouldPadFileStemToSixDigits() {
        assertEquals("000001", BarCsvLoader.codeOf(Path.of("1.csv")));
        assertEquals("600519", BarCsvLoader.codeOf(Path.of("data", "600519.csv")));
    }

    private Path write(String name, String content) throws Exception {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
