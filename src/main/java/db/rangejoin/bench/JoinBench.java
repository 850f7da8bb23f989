package db.rangejoin.bench;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import db.rangejoin.query.RangeJoin;
import db.rangejoin.range.Range;

/**
 * Micro-benchmark of the join over generated ranges.
 * Left: orders(customer_id, region, item). Right: customers(customer_id, region, name).
 */
public class JoinBench {

    /** Generated inputs for one benchmark session. */
    public static final class Inputs {
        public final Range left;
        public final Range right;
        public final Range rightMissing;

        Inputs(Range left, Range right, Range rightMissing) {
            this.left = left;
            this.right = right;
            this.rightMissing = rightMissing;
        }
    }

    public static void main(String[] args) throws Exception {
        Path root = Paths.get("benchdata");
        Files.createDirectories(root);
        System.out.println("Benchmark root: " + root.toAbsolutePath());

        BenchmarkConfig cfg = BenchmarkConfig.fromArgs(root, args);
        System.out.println("Generating left=" + cfg.leftRows + ", right=" + cfg.rightRows
            + ", keys=" + cfg.keyPoolSize);
        Inputs inputs = generate(cfg);

        Map<String, String> descriptions = Map.of(
            "inner_single", "INNER join on customer_id",
            "left_single", "LEFT join on customer_id",
            "inner_composite", "INNER join on (customer_id, region)",
            "left_miss", "LEFT join where no key matches (all rows NULL-padded)"
        );
        Map<String, StatsAggregator> stats = new LinkedHashMap<>();
        Map<String, StatsAggregator> rowStats = new LinkedHashMap<>();
        RangeJoin join = new RangeJoin();

        for (String scenario : cfg.scenarios) {
            StatsAggregator agg = new StatsAggregator();
            StatsAggregator rowsAgg = new StatsAggregator();
            for (int i = 0; i < cfg.warmup; i++) runScenario(join, scenario, inputs);
            for (int i = 0; i < cfg.runs; i++) {
                long t0 = System.nanoTime();
                int rows = runScenario(join, scenario, inputs);
                long t1 = System.nanoTime();
                agg.add(t1 - t0);
                rowsAgg.add(rows);
            }
            stats.put(scenario, agg);
            rowStats.put(scenario, rowsAgg);
            System.out.printf(Locale.ROOT,
                "%s -> count=%d rows=%d mean=%.2fms median=%.3fms p95=%.3fms min=%.3fms max=%.3fms%n",
                scenario, agg.count(), rowsAgg.median(), agg.mean() / 1_000_000.0, agg.median() / 1_000_000.0,
                agg.percentile(95) / 1_000_000.0, agg.min() / 1_000_000.0, agg.max() / 1_000_000.0);
        }

        ReportWriter writer = new ReportWriter(root.resolve("results"));
        Path report = writer.writeJson(stats, rowStats, descriptions, cfg);
        System.out.println("Wrote JSON to: " + report.toAbsolutePath());
    }

    public static Inputs generate(BenchmarkConfig cfg) {
        KeyPool pool = new KeyPool(cfg.keyPoolSize, cfg.seed);
        List<List<Object>> left = new ArrayList<>(cfg.leftRows + 1);
        left.add(List.of("customer_id", "region", "item"));
        for (int i = 1; i <= cfg.leftRows; i++) {
            int key = pool.randomKey();
            left.add(List.of(key, region(key), "I" + ((i % 500) + 1)));
        }
        List<List<Object>> right = new ArrayList<>(cfg.rightRows + 1);
        List<List<Object>> missing = new ArrayList<>(cfg.rightRows + 1);
        right.add(List.of("customer_id", "region", "name"));
        missing.add(List.of("customer_id", "region", "name"));
        for (int i = 1; i <= cfg.rightRows; i++) {
            int key = pool.randomKey();
            // right keys as text: matching is by canonical text, so 42 and "42" join
            right.add(List.of(Integer.toString(key), region(key), "Customer" + i));
            missing.add(List.of(pool.missingKey(), "R0", "Customer" + i));
        }
        return new Inputs(new Range(left), new Range(right), new Range(missing));
    }

    /** Runs one scenario and returns the number of data rows produced. */
    public static int runScenario(RangeJoin join, String scenario, Inputs in) {
        Range result = switch (scenario) {
            case "inner_single" -> join.join(in.left, in.right, 1, 1, "INNER", true);
            case "left_single" -> join.join(in.left, in.right, 1, 1, "LEFT", true);
            case "inner_composite" -> join.join(in.left, in.right, List.of(1, 2), List.of(1, 2), "INNER", true);
            case "left_miss" -> join.join(in.left, in.rightMissing, 1, 1, "LEFT", true);
            default -> throw new IllegalArgumentException("Unknown scenario: " + scenario);
        };
        return result.height() - 1;
    }

    private static String region(int key) {
        return "R" + (key % 8);
    }
}
