package db.rangejoin.bench;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

public class ReportWriter {
    private final Path outDir;

    public ReportWriter(Path outDir) {
        this.outDir = outDir;
    }

    /**
     * Writes bench_&lt;timestamp&gt;.json with per-scenario timings in milliseconds.
     * @return path of the written report
     */
    public Path writeJson(Map<String, StatsAggregator> timings,
                          Map<String, StatsAggregator> rowCounts,
                          Map<String, String> descriptions,
                          BenchmarkConfig cfg) throws IOException {
        if (!Files.exists(outDir)) Files.createDirectories(outDir);
        String ts = LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss"));
        Path json = outDir.resolve("bench_" + ts + ".json");
        Files.writeString(json, toJson(timings, rowCounts, descriptions, cfg));
        return json;
    }

    public String toJson(Map<String, StatsAggregator> timings,
                         Map<String, StatsAggregator> rowCounts,
                         Map<String, String> descriptions,
                         BenchmarkConfig cfg) {
        Map<String, Object> root = new LinkedHashMap<>();
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("left_rows", cfg.leftRows);
        config.put("right_rows", cfg.rightRows);
        config.put("key_pool", cfg.keyPoolSize);
        config.put("runs", cfg.runs);
        config.put("warmup", cfg.warmup);
        config.put("seed", cfg.seed);
        root.put("config", config);

        Map<String, Object> scenarios = new LinkedHashMap<>();
        for (Map.Entry<String, StatsAggregator> e : timings.entrySet()) {
            StatsAggregator s = e.getValue();
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("description", descriptions.getOrDefault(e.getKey(), ""));
            entry.put("mean_ms", round(s.mean() / 1_000_000.0, 100.0));
            entry.put("median_ms", round(s.median() / 1_000_000.0, 1000.0));
            entry.put("p95_ms", round(s.percentile(95) / 1_000_000.0, 1000.0));
            entry.put("min_ms", round(s.min() / 1_000_000.0, 1000.0));
            entry.put("max_ms", round(s.max() / 1_000_000.0, 1000.0));
            entry.put("stddev_ms", round(s.stddev() / 1_000_000.0, 100.0));
            StatsAggregator rows = rowCounts.get(e.getKey());
            if (rows != null) entry.put("rows", rows.median());
            scenarios.put(e.getKey(), entry);
        }
        root.put("scenarios", scenarios);

        Gson gson = new GsonBuilder().disableHtmlEscaping().setPrettyPrinting().create();
        return gson.toJson(root);
    }

    private static double round(double v, double scale) {
        return Math.round(v * scale) / scale;
    }
}
