package com.stockscan.cn.output;

import com.stockscan.cn.model.ExclusionReason;
import com.stockscan.cn.model.RankedResultSet;
import com.stockscan.cn.model.Verdict;
import com.stockscan.cn.runner.ScanSummary;
import org.json.JSONArray;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZonedDateTime;
import java.util.Map;

/**
 * Writes a JSON sidecar next to the result CSV with run counters, exclusion reasons and the
 * evaluation metrics of every returned verdict.
 */
public final class RunSummaryWriter {

    public JSONObject toJson(RankedResultSet ranked, ScanSummary summary, ZonedDateTime now) {
        JSONObject root = new JSONObject();
        root.put("profile", ranked.profile.tag());
        root.put("profile_name", ranked.profile.alias());
        root.put("generated_at", now.toOffsetDateTime().toString());
        root.put("total_files", summary.totalFiles());
        root.put("prefiltered", summary.prefiltered());
        root.put("scanned", summary.scanned());
        root.put("matched", summary.matched());
        root.put("failed", summary.failed());
        root.put("returned", ranked.size());
        root.put("truncated", ranked.isTruncated());
        root.put("elapsed_ms", summary.elapsedMs());

        JSONObject exclusions = new JSONObject();
        for (Map.Entry<ExclusionReason, Integer> entry : summary.exclusionCounts().entrySet()) {
            if (entry.getKey() != ExclusionReason.NONE && entry.getValue() > 0) {
                exclusions.put(entry.getKey().label(), entry.getValue().intValue());
            }
        }
        root.put("exclusions", exclusions);

        JSONArray codes = new JSONArray();
        JSONArray verdicts = new JSONArray();
        for (Verdict verdict : ranked.verdicts) {
            codes.put(verdict.code);
            verdicts.put(verdictJson(verdict));
        }
        root.put("codes", codes);
        root.put("verdicts", verdicts);
        return root;
    }

    // Per-verdict evaluation metrics so a match can be re-checked without rerunning the scan.
    private JSONObject verdictJson(Verdict verdict) {
        JSONObject item = new JSONObject();
        item.put("code", verdict.code);
        item.put("name", verdict.name);
        item.put("latest_close", verdict.latestClose);
        item.put("latest_volume", verdict.latestVolume);
        item.put("reference_price", verdict.referencePrice);
        item.put("reference_volume", verdict.referenceVolume);
        if (verdict.isScored()) {
            item.put("score", verdict.score.intValue());
            item.put("advice", verdict.adviceOrEmpty());
        }
        JSONObject metrics = new JSONObject();
        if (verdict.metrics != null) {
            for (Map.Entry<String, Object> entry : verdict.metrics.entrySet()) {
                metrics.put(entry.getKey(), entry.getValue());
            }
        }
        item.put("metrics", metrics);
        return item;
    }

    public Path write(Path csvPath, RankedResultSet ranked, ScanSummary summary, ZonedDateTime now) throws IOException {
        String fileName = csvPath.getFileName().toString();
        String stem = fileName.endsWith(".csv") ? fileName.substring(0, fileName.length() - 4) : fileName;
        Path out = csvPath.resolveSibling(stem + ".summary.json");
        Files.writeString(out, toJson(ranked, summary, now).toString(2), StandardCharsets.UTF_8);
        return out;
    }
}
