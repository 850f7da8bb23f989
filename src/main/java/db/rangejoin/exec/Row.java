package db.rangejoin.exec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Row is the execution pipeline unit: an ordered list of cell values (null allowed for NULL padding).
 */
public final class Row {
    private final List<Object> values;

    private Row(List<Object> values) {
        this.values = values;
    }

    public static Row of(List<?> values) {
        return new Row(Collections.unmodifiableList(new ArrayList<>(values)));
    }

    public List<Object> values() { return values; }
    public int width() { return values.size(); }

    /** Values at the given indexes, in that order. */
    public Row select(int[] indexes) {
        List<Object> out = new ArrayList<>(indexes.length);
        for (int idx : indexes) out.add(values.get(idx));
        return new Row(Collections.unmodifiableList(out));
    }

    public Row concat(Row other) {
        List<Object> combined = new ArrayList<>(values.size() + other.values.size());
        combined.addAll(values);
        combined.addAll(other.values);
        return new Row(Collections.unmodifiableList(combined));
    }

    // This row followed by count NULL cells
    public Row padded(int count) {
        List<Object> combined = new ArrayList<>(values.size() + count);
        combined.addAll(values);
        for (int i = 0; i < count; i++) combined.add(null);
        return new Row(Collections.unmodifiableList(combined));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Row)) return false;
        return values.equals(((Row) o).values);
    }

    @Override
    public int hashCode() { return values.hashCode(); }

    @Override
    public String toString() { return "Row" + values; }
}
