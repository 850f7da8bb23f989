package db.rangejoin.bench;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

public class BenchmarkConfig {
    public final int leftRows;
    public final int rightRows;
    public final int keyPoolSize;
    public final int runs;
    public final int warmup;
    public final long seed;
    public final Path benchRoot;
    public final List<String> scenarios;

    public BenchmarkConfig(int leftRows,
                           int rightRows,
                           int keyPoolSize,
                           int runs,
                           int warmup,
                           long seed,
                           Path benchRoot,
                           List<String> scenarios) {
        this.leftRows = leftRows;
        this.rightRows = rightRows;
        this.keyPoolSize = keyPoolSize;
        this.runs = runs;
        this.warmup = warmup;
        this.seed = seed;
        this.benchRoot = benchRoot;
        this.scenarios = scenarios;
    }

    public static List<String> allScenarios() {
        return Arrays.asList("inner_single", "left_single", "inner_composite", "left_miss");
    }

    public static BenchmarkConfig defaultConfig(Path benchRoot) {
        return fromArgs(benchRoot, new String[0]);
    }

    public static BenchmarkConfig fromArgs(Path benchRoot, String[] args) {
        int leftRows = 10_000;
        int keyPool = -1;
        int runs = 50;
        int warmup = 5;
        long seed = 42L;

        for (String a : args) {
            if (a == null) continue;
            String s = a.trim();
            try {
                if (s.startsWith("--rows=")) {
                    leftRows = Integer.parseInt(s.substring("--rows=".length()));
                } else if (s.startsWith("--keys=")) {
                    keyPool = Integer.parseInt(s.substring("--keys=".length()));
                } else if (s.startsWith("--runs=")) {
                    runs = Integer.parseInt(s.substring("--runs=".length()));
                } else if (s.startsWith("--warmup=")) {
                    warmup = Integer.parseInt(s.substring("--warmup=".length()));
                } else if (s.startsWith("--seed=")) {
                    seed = Long.parseLong(s.substring("--seed=".length()));
                } else {
                    System.err.println("[BenchmarkConfig] Ignoring unknown argument: " + s);
                }
            } catch (NumberFormatException e) {
                System.err.println("[BenchmarkConfig] Ignoring non-numeric value: " + s);
            }
        }

        leftRows = Math.max(1, leftRows);
        // right side is 0.1x the left side, keys scale with the left side unless given
        int rightRows = Math.max(1, leftRows / 10);
        if (keyPool < 1) keyPool = leftRows;
        return new BenchmarkConfig(leftRows, rightRows, keyPool, Math.max(1, runs), Math.max(0, warmup),
            seed, benchRoot, allScenarios());
    }
}
