package db.rangejoin.bench;

import java.util.Arrays;

/**
 * Collects timing (or row count) samples and reports summary statistics.
 */
public class StatsAggregator {
    private long[] samples = new long[16];
    private int count;

    public void add(long sample) {
        if (count == samples.length) samples = Arrays.copyOf(samples, count * 2);
        samples[count++] = sample;
    }

    public int count() { return count; }

    public long min() { return count == 0 ? 0 : sorted()[0]; }
    public long max() { return count == 0 ? 0 : sorted()[count - 1]; }

    public double mean() {
        if (count == 0) return 0.0;
        long sum = 0L;
        for (int i = 0; i < count; i++) sum += samples[i];
        return (double) sum / count;
    }

    // Sample variance, n-1 denominator
    public double variance() {
        if (count < 2) return 0.0;
        double m = mean();
        double acc = 0.0;
        for (int i = 0; i < count; i++) {
            double diff = samples[i] - m;
            acc += diff * diff;
        }
        return acc / (count - 1);
    }

    public double stddev() { return Math.sqrt(variance()); }

    public long median() {
        if (count == 0) return 0L;
        long[] s = sorted();
        int mid = count / 2;
        return count % 2 == 0 ? (s[mid - 1] + s[mid]) / 2 : s[mid];
    }

    /** Nearest-rank percentile, p in (0, 100]. */
    public long percentile(double p) {
        if (p <= 0 || p > 100) throw new IllegalArgumentException("percentile must be in (0, 100]: " + p);
        if (count == 0) return 0L;
        int rank = (int) Math.ceil(p / 100.0 * count);
        return sorted()[Math.max(0, rank - 1)];
    }

    private long[] sorted() {
        long[] copy = Arrays.copyOf(samples, count);
        Arrays.sort(copy);
        return copy;
    }
}
