package db.rangejoin.exec;

import db.rangejoin.range.Range;

/**
 * Scans the data rows of a range in order, skipping the header row when present.
 */
public class RangeScanOperator implements Operator {
    private final Range range;
    private final boolean hasHeader;

    private int cursor;
    private boolean opened;

    public RangeScanOperator(Range range, boolean hasHeader) {
        if (range == null) throw new IllegalArgumentException("range must not be null");
        this.range = range;
        this.hasHeader = hasHeader;
    }

    @Override
    public void open() {
        cursor = hasHeader ? 1 : 0;
        opened = true;
    }

    @Override
    public Row next() {
        if (!opened || cursor >= range.height()) return null;
        return Row.of(range.row(cursor++));
    }

    @Override
    public void close() {
        opened = false;
    }

    @Override
    public Row header() {
        return hasHeader && range.height() > 0 ? Row.of(range.row(0)) : null;
    }

    public int width() { return range.width(); }
}
