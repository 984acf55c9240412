package com.stockscan.cn.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void getters_shouldFallBackToBuiltInDefaults() {
        Config config = Config.fromMap(tempDir, Map.of());

        assertEquals("B", config.getString("app.profile"));
        assertEquals(30, config.getInt("profile.a.min_history_bars"));
        assertEquals(0.03, config.getDouble("profile.b.volume.shrink_ratio"), 1e-12);
        assertEquals(List.of("30", "688"), config.getList("profile.a.denied_prefixes"));
        assertEquals(List.of(), config.getList("profile.a.allowed_prefixes"));
        assertEquals("default", config.sourceOf("app.profile"));
    }

    @Test
    void localFile_shouldOverrideClasspathResource() throws Exception {
        Files.writeString(
                tempDir.resolve("config.properties"),
                "app.profile=A\nnames.placeholder=无名\nscan.threads=4\n",
                StandardCharsets.UTF_8
        );

        Config config = Config.load(tempDir);

        assertEquals("A", config.getString("app.profile"));
        assertEquals("file", config.sourceOf("app.profile"));
        assertEquals("无名", config.getString("names.placeholder"));
        assertEquals(4, config.getInt("scan.threads"));
        assertEquals("resource", config.sourceOf("data.dir"));
    }

    @Test
    void withOverrides_shouldWinAndLeaveOriginalUntouched() {
        Config base = Config.fromMap(tempDir, Map.of());

        Config overridden = base.withOverrides(Map.of("app", Map.of("profile", "A"), "scan.threads", 8));

        assertEquals("A", overridden.getString("app.profile"));
        assertEquals(8, overridden.getInt("scan.threads"));
        assertEquals("override", overridden.sourceOf("app.profile"));
        assertEquals("B", base.getString("app.profile"));
    }

    @Test
    void getPath_shouldResolveAgainstWorkingDirectory() {
        Config config = Config.fromMap(tempDir, Map.of("data", Map.of("dir", "stock_data")));

        assertEquals(tempDir.resolve("stock_data"), config.getPath("data.dir"));
    }

    @Test
    void parsers_shouldIgnoreMalformedValues() {
        Config config = Config.fromMap(tempDir, Map.of(
                "scan.threads", "many",
                "list", List.of("60", " 00 ")
        ));

        assertEquals(7, config.getInt("scan.threads", 7));
        assertEquals(List.of("60", "00"), config.getList("list"));
    }
}
