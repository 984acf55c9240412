package com.stockscan.cn.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * 模块说明：Config（class）。
 * 主要职责：按“内置默认值 → classpath config.properties → 工作目录 config.properties → 命令行覆盖”的顺序合并扫描参数。
 * 使用建议：新增配置键时同步补充 buildDefaults，避免各处散落魔法数字。
 */
public final class Config {

    private static final Map<String, String> DEFAULTS = buildDefaults();

    private final Properties props = new Properties();
    private final Properties resourceProps = new Properties();
    private final Properties fileProps = new Properties();
    private final Properties overrideProps = new Properties();
    private final Path workingDir;

    private Config(Path workingDir) {
        this.workingDir = workingDir;
    }

/**
 * 方法说明：load，负责加载 classpath 与工作目录下的 config.properties。
 * 处理流程：文件缺失时静默使用默认值；文件损坏时输出告警后继续。
 * 维护提示：配置文件统一按 UTF-8 读取，以便写入中文列名。
 */
    public static Config load(Path workingDir) {
        Config config = new Config(workingDir);

        try (InputStream in = Config.class.getClassLoader().getResourceAsStream("config.properties")) {
            if (in != null) {
                try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                    config.resourceProps.load(reader);
                }
                config.props.putAll(config.resourceProps);
            }
        } catch (IOException e) {
            System.err.println("WARN: failed to read classpath config.properties: " + e.getMessage());
        }

        Path local = workingDir.resolve("config.properties");
        if (Files.exists(local)) {
            try (Reader reader = Files.newBufferedReader(local, StandardCharsets.UTF_8)) {
                config.fileProps.load(reader);
                config.props.putAll(config.fileProps);
            } catch (IOException e) {
                System.err.println("WARN: failed to read config.properties: " + e.getMessage());
            }
        }

        return config;
    }

    /**
     * Build Config from a nested map, e.g. {@code Map.of("profile", Map.of("a", Map.of("top_n", 3)))}.
     */
    public static Config fromMap(Path workingDir, Map<String, ?> rawProperties) {
        Config config = new Config(workingDir);
        flattenInto(config, "", rawProperties);
        return config;
    }

/**
 * 方法说明：withOverrides，负责在现有配置之上叠加命令行参数。
 * 处理流程：复制当前各层配置后写入覆盖层，原对象保持不变。
 */
    public Config withOverrides(Map<String, ?> overrides) {
        Config copy = new Config(workingDir);
        copy.resourceProps.putAll(resourceProps);
        copy.fileProps.putAll(fileProps);
        copy.overrideProps.putAll(overrideProps);
        copy.props.putAll(props);
        flattenInto(copy, "", overrides);
        return copy;
    }

    public String getString(String key) {
        String raw = props.getProperty(key);
        if (raw != null) {
            String trimmed = raw.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return DEFAULTS.getOrDefault(key, "");
    }

    public String getString(String key, String fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return value;
    }

    public int getInt(String key) {
        return getInt(key, parseInt(DEFAULTS.get(key), 0));
    }

    public int getInt(String key, int fallback) {
        String value = getString(key);
        return parseInt(value, fallback);
    }

    public double getDouble(String key) {
        return getDouble(key, parseDouble(DEFAULTS.get(key), 0.0));
    }

    public double getDouble(String key, double fallback) {
        String value = getString(key);
        return parseDouble(value, fallback);
    }

/**
 * 方法说明：getPath，负责把相对路径解析到工作目录下。
 * 处理流程：未配置时返回工作目录本身。
 */
    public Path getPath(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return workingDir;
        }
        return workingDir.resolve(value).normalize();
    }

/**
 * 方法说明：getList，负责读取逗号或分号分隔的列表配置。
 * 处理流程：逐项去除首尾空白并丢弃空项；显式配置为 "-" 时返回空列表，用于关闭默认名单。
 */
    public List<String> getList(String key) {
        String value = getString(key);
        if (value.isEmpty() || "-".equals(value)) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        String[] tokens = value.split("[,;]");
        for (String token : tokens) {
            String trimmed = token.trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return out;
    }

/**
 * 方法说明：sourceOf，负责说明某个配置键的最终取值来源。
 * 处理流程：按覆盖层、本地文件、classpath 的优先级依次判断，都没有时视为默认值。
 */
    public String sourceOf(String key) {
        if (key == null || key.trim().isEmpty()) {
            return "default";
        }
        if (!nonBlank(overrideProps.getProperty(key)).isEmpty()) {
            return "override";
        }
        if (!nonBlank(fileProps.getProperty(key)).isEmpty()) {
            return "file";
        }
        if (!nonBlank(resourceProps.getProperty(key)).isEmpty()) {
            return "resource";
        }
        return "default";
    }

    private String nonBlank(String raw) {
        if (raw == null) {
            return "";
        }
        String t = raw.trim();
        return t.isEmpty() ? "" : t;
    }

    private static void flattenInto(Config config, String prefix, Object value) {
        if (config == null || value == null) {
            return;
        }
        if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = entry.getKey() == null ? "" : entry.getKey().toString().trim();
                if (key.isEmpty()) {
                    continue;
                }
                String fullKey = prefix.isEmpty() ? key : prefix + "." + key;
                flattenInto(config, fullKey, entry.getValue());
            }
            return;
        }
        if (value instanceof List<?> list) {
            List<String> parts = new ArrayList<>();
            for (Object item : list) {
                parts.add(stringify(item));
            }
            putOverride(config, prefix, String.join(",", parts));
            return;
        }
        putOverride(config, prefix, stringify(value));
    }

    private static void putOverride(Config config, String key, String value) {
        if (key == null || key.trim().isEmpty()) {
            return;
        }
        String normalizedKey = key.trim();
        String normalizedValue = value == null ? "" : value;
        config.overrideProps.setProperty(normalizedKey, normalizedValue);
        config.props.setProperty(normalizedKey, normalizedValue);
    }

    private static String stringify(Object value) {
        return value == null ? "" : String.valueOf(value);
    }

    private static int parseInt(String value, int fallback) {
        try {
            return Integer.parseInt(value.trim());
        } catch (Exception ignored) {
            return fallback;
        }
    }

    private static double parseDouble(String value, double fallback) {
        try {
            return Double.parseDouble(value.trim());
        } catch (Exception ignored) {
            return fallback;
        }
    }

    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new HashMap<>();

        defaults.put("app.zone", "Asia/Shanghai");
        defaults.put("app.profile", "B");
        defaults.put("data.dir", "stock_data");
        defaults.put("names.file", "stock_names.csv");
        defaults.put("outputs.dir", "output");
        defaults.put("names.placeholder", "未知名称");

        defaults.put("csv.column.date", "日期");
        defaults.put("csv.column.open", "开盘");
        defaults.put("csv.column.close", "收盘");
        defaults.put("csv.column.volume", "成交量");

        defaults.put("scan.threads", "0");
        defaults.put("scan.progress.log_every", "500");

        defaults.put("eligibility.special_markers", "ST,PT,*");

        // Profile A: 龙回头缩量回踩
        defaults.put("profile.a.min_history_bars", "30");
        defaults.put("profile.a.denied_prefixes", "30,688");
        defaults.put("profile.a.allowed_prefixes", "-");
        defaults.put("profile.a.price.min", "5.0");
        defaults.put("profile.a.price.max", "20.0");
        defaults.put("profile.a.volume_period", "20");
        defaults.put("profile.a.price_period", "20");
        defaults.put("profile.a.support.max_proximity", "0.03");
        defaults.put("profile.a.volume.max_ratio", "0.5");
        defaults.put("profile.a.sma_period", "5");
        defaults.put("profile.a.score.base", "70");
        defaults.put("profile.a.score.sma_bonus", "20");
        defaults.put("profile.a.score.reexpansion_bonus", "10");
        defaults.put("profile.a.score.min", "70");
        defaults.put("profile.a.top_n", "5");

        // Profile B: 缩量见底
        defaults.put("profile.b.min_history_bars", "120");
        defaults.put("profile.b.denied_prefixes", "30");
        defaults.put("profile.b.allowed_prefixes", "60,00");
        defaults.put("profile.b.price.min", "5.0");
        defaults.put("profile.b.price.max", "15.0");
        defaults.put("profile.b.volume_period", "120");
        defaults.put("profile.b.price_period", "40");
        defaults.put("profile.b.volume.shrink_ratio", "0.03");
        defaults.put("profile.b.price.low_range_ratio", "0.03");
        defaults.put("profile.b.top_n", "0");

        return Collections.unmodifiableMap(defaults);
    }
}
