package com.stockscan.cn.runner;

import com.stockscan.cn.config.Config;
import com.stockscan.cn.data.BarCsvLoader;
import com.stockscan.cn.data.StockNameDirectory;
import com.stockscan.cn.model.BarSeries;
import com.stockscan.cn.model.InstrumentIdentity;
import com.stockscan.cn.model.InstrumentScanResult;
import com.stockscan.cn.model.RankedResultSet;
import com.stockscan.cn.model.Verdict;
import com.stockscan.cn.strategy.EligibilityFilter;
import com.stockscan.cn.strategy.InstrumentScreener;
import com.stockscan.cn.strategy.ScreenProfile;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * 模块说明：ScanRunner（class）。
 * 主要职责：按文件并行扫描全部证券，收齐结果后统一排序输出。
 * 使用建议：扫描任务之间只共享只读的名称表与无状态的判定器，不需要加锁；排序必须等所有任务完成后进行。
 */
public final class ScanRunner {
    private static final Logger LOG = LogManager.getLogger(ScanRunner.class);

    private final Config config;
    private final InstrumentScreener screener;
    private final StockNameDirectory names;
    private final BarCsvLoader loader;
    private final ResultRanker ranker;

    public ScanRunner(Config config, ScreenProfile profile, StockNameDirectory names) {
        this(config, new InstrumentScreener(profile), names, new BarCsvLoader(config), new ResultRanker());
    }

    public ScanRunner(
            Config config,
            InstrumentScreener screener,
            StockNameDirectory names,
            BarCsvLoader loader,
            ResultRanker ranker
    ) {
        this.config = config;
        this.screener = screener;
        this.names = names;
        this.loader = loader;
        this.ranker = ranker;
    }

/**
 * 方法说明：run，负责一次完整扫描：列文件 → 代码预过滤 → 线程池评估 → 汇总排序。
 * 处理流程：数据目录缺失或为空时抛出 BatchInputException；单个文件的任何异常只影响该文件自身的结果。
 * 维护提示：结果按文件顺序落位而非完成顺序，保证同分排序与多次运行结果一致。
 */
    public ScanReport run(Path dataDir) throws BatchInputException, InterruptedException {
        long startedNanos = System.nanoTime();
        ScreenProfile profile = screener.profile();
        List<Path> files = loader.listInstrumentFiles(dataDir);

        ScanSummary summary = new ScanSummary(profile.type);
        summary.totalFiles = files.size();

        EligibilityFilter eligibility = screener.eligibilityFilter();
        List<Path> admitted = new ArrayList<>(files.size());
        for (Path file : files) {
            if (eligibility.admitsCode(BarCsvLoader.codeOf(file), profile)) {
                admitted.add(file);
            } else {
                summary.recordPrefiltered();
            }
        }

        int threads = resolveThreads();
        int logEvery = Math.max(0, config.getInt("scan.progress.log_every", 500));
        LOG.info("scanning {} of {} files with {} threads, profile={}", admitted.size(), files.size(), threads, profile.type);

        InstrumentScanResult[] slots = new InstrumentScanResult[admitted.size()];
        if (!admitted.isEmpty()) {
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            CompletionService<IndexedResult> completion = new ExecutorCompletionService<>(pool);
            try {
                for (int i = 0; i < admitted.size(); i++) {
                    completion.submit(new InstrumentTask(i, admitted.get(i)));
                }
                for (int done = 1; done <= admitted.size(); done++) {
                    Future<IndexedResult> future = completion.take();
                    try {
                        IndexedResult indexed = future.get();
                        slots[indexed.index] = indexed.result;
                    } catch (ExecutionException e) {
                        // Only Errors escape scanFile.
                        LOG.warn("scan task failed unexpectedly: {}", String.valueOf(e.getCause()));
                    }
                    if (shouldLogProgress(done, admitted.size(), logEvery)) {
                        LOG.info(String.format(Locale.US, "Progress done=%d/%d (%.1f%%)",
                                done, admitted.size(), done * 100.0 / admitted.size()));
                    }
                }
            } finally {
                pool.shutdownNow();
            }
        }

        List<InstrumentScanResult> results = new ArrayList<>(slots.length);
        List<Verdict> verdicts = new ArrayList<>();
        for (int i = 0; i < slots.length; i++) {
            InstrumentScanResult result = slots[i] == null
                    ? InstrumentScanResult.failed(BarCsvLoader.codeOf(admitted.get(i)), new IllegalStateException("no result"))
                    : slots[i];
            results.add(result);
            summary.record(result);
            if (result.isMatched()) {
                verdicts.add(result.verdict);
            }
        }

        RankedResultSet ranked = ranker.rank(verdicts, profile);
        summary.elapsedMs = Math.max(0L, (System.nanoTime() - startedNanos) / 1_000_000L);
        LOG.info("scan finished: {}", summary.toLogLine());
        return new ScanReport(ranked, results, summary);
    }

/**
 * 方法说明：scanFile，负责加载单个行情文件并执行判定。
 * 处理流程：读取、解析或计算中的任何异常都转换为失败结果并记录日志，绝不向上抛出。
 */
    InstrumentScanResult scanFile(Path file) {
        String code = BarCsvLoader.codeOf(file);
        try {
            InstrumentIdentity identity = names.identityOf(code);
            BarSeries series = loader.load(file);
            InstrumentScanResult result = screener.screen(identity, series);
            if (result.reason.isDataProblem()) {
                LOG.debug("instrument {} skipped for data: {} {}", code, result.reason.label(), result.error);
            }
            return result;
        } catch (Exception e) {
            LOG.warn("Error processing file {}: {}", file.getFileName(), e.getMessage());
            return InstrumentScanResult.failed(code, e);
        }
    }

    private int resolveThreads() {
        int configured = config.getInt("scan.threads", 0);
        if (configured > 0) {
            return configured;
        }
        return Math.max(1, Runtime.getRuntime().availableProcessors() * 2);
    }

    private boolean shouldLogProgress(int completed, int total, int logEvery) {
        if (completed >= total) {
            return true;
        }
        if (logEvery <= 0) {
            return false;
        }
        return completed % logEvery == 0;
    }

    private static final class IndexedResult {
        final int index;
        final InstrumentScanResult result;

        private IndexedResult(int index, InstrumentScanResult result) {
            this.index = index;
            this.result = result;
        }
    }

    private final class InstrumentTask implements Callable<IndexedResult> {
        private final int index;
        private final Path file;

        private InstrumentTask(int index, Path file) {
            this.index = index;
            this.file = file;
        }

        @Override
        public IndexedResult call() {
            return new IndexedResult(index, scanFile(file));
        }
    }
}
