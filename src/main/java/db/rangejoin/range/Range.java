package db.rangejoin.range;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Immutable ordered sequence of rows of cell values.
 * Cells are String, Number, Boolean, "" for a blank cell, or null for NULL padding in join output.
 * Rows are not required to share a width here; the validator rejects jagged input.
 */
public final class Range implements RangeSource {
    /** Empty sentinel: one row of zero columns. */
    public static final Range EMPTY = new Range(List.of(List.of()));

    private final List<List<Object>> rows;

    public Range(List<? extends List<?>> rows) {
        if (rows == null) throw new IllegalArgumentException("rows must not be null");
        List<List<Object>> copy = new ArrayList<>(rows.size());
        for (List<?> row : rows) {
            if (row == null) throw new IllegalArgumentException("row must not be null");
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public static Range of(Object[]... rows) {
        List<List<Object>> list = new ArrayList<>(rows.length);
        for (Object[] r : rows) list.add(Arrays.asList(r));
        return new Range(list);
    }

    public List<List<Object>> rows() { return rows; }

    @Override
    public Object rawValues() { return rows; }
    public List<Object> row(int index) { return rows.get(index); }
    public int height() { return rows.size(); }

    // Width of the first row; 0 for a range without rows
    public int width() { return rows.isEmpty() ? 0 : rows.get(0).size(); }

    public boolean isEmpty() { return rows.isEmpty() || width() == 0; }

    public boolean isRectangular() {
        int w = width();
        for (List<Object> r : rows) {
            if (r.size() != w) return false;
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Range)) return false;
        return rows.equals(((Range) o).rows);
    }

    @Override
    public int hashCode() { return rows.hashCode(); }

    @Override
    public String toString() { return "Range" + rows; }
}
