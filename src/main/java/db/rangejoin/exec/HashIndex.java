package db.rangejoin.exec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Composite key -> rows sharing that key, in insertion order.
 * Built per join and owned by the operator that builds it.
 */
public final class HashIndex {
    private final Map<String, List<Row>> buckets = new HashMap<>();
    private int size;

    public void add(String key, Row row) {
        buckets.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
        size++;
    }

    /** Rows stored under key, empty when there are none. */
    public List<Row> lookup(String key) {
        List<Row> rows = buckets.get(key);
        return rows == null ? Collections.emptyList() : Collections.unmodifiableList(rows);
    }

    public int size() { return size; }

    public int distinctKeys() { return buckets.size(); }
}
