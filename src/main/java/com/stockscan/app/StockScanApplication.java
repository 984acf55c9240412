package com.stockscan.app;

import com.stockscan.cn.config.Config;
import com.stockscan.cn.data.StockNameDirectory;
import com.stockscan.cn.model.ProfileType;
import com.stockscan.cn.model.RankedResultSet;
import com.stockscan.cn.output.ConsoleReport;
import com.stockscan.cn.output.ResultCsvWriter;
import com.stockscan.cn.output.RunSummaryWriter;
import com.stockscan.cn.runner.BatchInputException;
import com.stockscan.cn.runner.ScanReport;
import com.stockscan.cn.runner.ScanRunner;
import com.stockscan.cn.strategy.ScreenProfile;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public final class StockScanApplication {
    private static volatile boolean LOG_DIR_INSTALLED = false;

    private final Path workingDir;
    private final Clock clock;
    private Logger log;

    public StockScanApplication() {
        this(Path.of(".").toAbsolutePath().normalize(), Clock.systemDefaultZone());
    }

    public StockScanApplication(Path workingDir, Clock clock) {
        this.workingDir = workingDir;
        this.clock = clock;
    }

    public static void main(String[] args) {
        int exit = new StockScanApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args == null ? new String[0] : args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("stockscan", options);
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp("stockscan", options);
            return 0;
        }

        Config config;
        ProfileType profileType;
        try {
            config = Config.load(workingDir).withOverrides(overridesFrom(cmd));
            profileType = ProfileType.fromText(config.getString("app.profile"));
        } catch (IllegalArgumentException e) {
            new HelpFormatter().printHelp("stockscan", options);
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        }

        installLogDirIfNeeded(config);
        log = LogManager.getLogger(StockScanApplication.class);
        try {
            return runScan(config, profileType);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("scan interrupted");
            return 130;
        } catch (Exception e) {
            log.error("FATAL: {}", e.getMessage(), e);
            return 1;
        }
    }

    private int runScan(Config config, ProfileType profileType) throws IOException, InterruptedException {
        ScreenProfile profile = ScreenProfile.fromConfig(profileType, config);
        log.info(String.format(
                Locale.US,
                "--- 启动扫描 profile=%s 价格 [%.2f, %.2f] 最少历史 %d 根 (app.profile 来源: %s) ---",
                profileType,
                profile.priceMin,
                profile.priceMax,
                profile.minHistoryBars,
                config.sourceOf("app.profile")
        ));

        ZoneId zone = ZoneId.of(config.getString("app.zone", "Asia/Shanghai"));
        ZonedDateTime now = ZonedDateTime.now(clock.withZone(zone));
        ResultCsvWriter csvWriter = new ResultCsvWriter(config.getPath("outputs.dir"));
        ConsoleReport consoleReport = new ConsoleReport();

        StockNameDirectory names = StockNameDirectory.load(
                config.getPath("names.file"),
                config.getString("names.placeholder")
        );
        ScanRunner runner = new ScanRunner(config, profile, names);

        ScanReport report;
        try {
            report = runner.run(config.getPath("data.dir"));
        } catch (BatchInputException e) {
            log.error("Error: {}", e.getMessage());
            if (profileType == ProfileType.DEEP_CONTRACTION) {
                Path empty = csvWriter.write(new RankedResultSet(profileType, List.of(), 0), now);
                log.info("已创建空结果文件: {}", empty);
            }
            return 2;
        }

        Path savedTo = null;
        if (!report.ranked.isEmpty() || profileType == ProfileType.DEEP_CONTRACTION) {
            savedTo = csvWriter.write(report.ranked, now);
            Path summaryPath = new RunSummaryWriter().write(savedTo, report.ranked, report.summary, now);
            log.info("run summary written: {}", summaryPath);
        }
        System.out.println(consoleReport.render(report.ranked, report.summary, savedTo));
        return 0;
    }

    private Map<String, Object> overridesFrom(CommandLine cmd) {
        Map<String, Object> overrides = new LinkedHashMap<>();
        putIfPresent(overrides, cmd, "profile", "app.profile");
        putIfPresent(overrides, cmd, "data-dir", "data.dir");
        putIfPresent(overrides, cmd, "names-file", "names.file");
        putIfPresent(overrides, cmd, "output-dir", "outputs.dir");
        putIfPresent(overrides, cmd, "threads", "scan.threads");
        if (cmd.hasOption("top-n")) {
            String raw = cmd.getOptionValue("top-n").trim();
            try {
                Integer.parseInt(raw);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("--top-n must be an integer: " + raw);
            }
            overrides.put("profile.a.top_n", raw);
            overrides.put("profile.b.top_n", raw);
        }
        return overrides;
    }

    private void putIfPresent(Map<String, Object> overrides, CommandLine cmd, String option, String key) {
        if (cmd.hasOption(option)) {
            overrides.put(key, cmd.getOptionValue(option));
        }
    }

    private void installLogDirIfNeeded(Config config) {
        if (LOG_DIR_INSTALLED) {
            return;
        }
        synchronized (StockScanApplication.class) {
            if (LOG_DIR_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath("outputs.dir").resolve("log");
                Files.createDirectories(logDir);
                // Must be set before the first LogManager call so the file appender picks it up.
                System.setProperty("stockscan.log.dir", logDir.toAbsolutePath().toString());
                LOG_DIR_INSTALLED = true;
            } catch (IOException e) {
                System.err.println("WARN: failed to prepare log directory: " + e.getMessage());
            }
        }
    }

    private Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder("p").longOpt("profile").hasArg().argName("A|B")
                .desc("screening profile: A/support-retest (龙回头缩量回踩) or B/deep-contraction (缩量见底)").build());
        options.addOption(Option.builder().longOpt("data-dir").hasArg().argName("dir")
                .desc("directory holding one <code>.csv per instrument").build());
        options.addOption(Option.builder().longOpt("names-file").hasArg().argName("path")
                .desc("code,name csv used for display names and ST filtering").build());
        options.addOption(Option.builder().longOpt("output-dir").hasArg().argName("dir")
                .desc("root directory for dated result files").build());
        options.addOption(Option.builder().longOpt("threads").hasArg().argName("n")
                .desc("scan worker threads, 0 = 2 x CPU cores").build());
        options.addOption(Option.builder().longOpt("top-n").hasArg().argName("n")
                .desc("maximum rows in the result set, 0 = unbounded").build());
        options.addOption(Option.builder("h").longOpt("help").desc("show help").build());
        return options;
    }
}
