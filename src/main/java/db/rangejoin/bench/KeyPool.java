package db.rangejoin.bench;

import java.util.Random;

/**
 * Fixed pool of join key values; sampling from it produces duplicate keys on both sides.
 */
public class KeyPool {
    private final int[] keys;
    private final Random rnd;

    public KeyPool(int poolSize, long seed) {
        if (poolSize < 1) throw new IllegalArgumentException("poolSize must be >= 1");
        this.rnd = new Random(seed);
        this.keys = new int[poolSize];
        for (int i = 0; i < poolSize; i++) {
            keys[i] = 1 + rnd.nextInt(1_000_000_000);
        }
    }

    public int randomKey() {
        return keys[rnd.nextInt(keys.length)];
    }

    // Key outside the pool; never matches
    public int missingKey() {
        return -1 - rnd.nextInt(1_000_000);
    }

    public int size() { return keys.length; }
}
