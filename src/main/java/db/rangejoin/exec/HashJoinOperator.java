package db.rangejoin.exec;

import java.util.Collections;
import java.util.List;

import db.rangejoin.query.JoinType;

/**
 * Hash equi-join on composite keys: leftColumns == rightColumns.
 * The right child is materialized into a {@link HashIndex} on open; the left child is probed row by row.
 * Output rows are the left row followed by the right row without its join columns.
 * For LEFT joins an unmatched left row is emitted once, padded with NULLs.
 */
public class HashJoinOperator implements Operator {
    private final Operator left;
    private final Operator right;
    private final int[] leftColumns;
    private final int[] rightColumns;
    private final JoinType joinType;
    private final int[] rightKept; // right columns carried into the output
    private final CompositeKeyBuilder keys = new CompositeKeyBuilder();

    private HashIndex index;
    private Row currentLeft;
    private List<Row> currentMatchList = Collections.emptyList();
    private int matchIndex = 0; // index within currentMatchList

    public HashJoinOperator(Operator left, Operator right, int[] leftColumns, int[] rightColumns,
                            JoinType joinType, int rightWidth) {
        if (leftColumns.length == 0 || leftColumns.length != rightColumns.length) {
            throw new IllegalArgumentException("Join columns must be non-empty and of equal length");
        }
        this.left = left;
        this.right = right;
        this.leftColumns = leftColumns.clone();
        this.rightColumns = rightColumns.clone();
        this.joinType = joinType == null ? JoinType.INNER : joinType;
        this.rightKept = keptColumns(rightWidth, rightColumns);
    }

    @Override
    public void open() {
        left.open();
        right.open();
        index = new HashIndex();
        Row r;
        while ((r = right.next()) != null) {
            index.add(keys.buildKey(r, rightColumns), r.select(rightKept));
        }
        right.close(); // no longer needed
        currentLeft = left.next();
        currentMatchList = Collections.emptyList();
        matchIndex = 0;
    }

    @Override
    public Row next() {
        while (true) {
            if (currentLeft == null) return null;

            if (matchIndex < currentMatchList.size()) {
                Row output = currentLeft.concat(currentMatchList.get(matchIndex++));
                if (matchIndex >= currentMatchList.size()) advanceLeft();
                return output;
            }

            List<Row> matches = index.lookup(keys.buildKey(currentLeft, leftColumns));
            if (matches.isEmpty()) {
                Row unmatched = currentLeft;
                advanceLeft();
                if (joinType == JoinType.LEFT) return unmatched.padded(rightKept.length);
                continue;
            }
            currentMatchList = matches;
            matchIndex = 0;
        }
    }

    private void advanceLeft() {
        currentLeft = left.next();
        currentMatchList = Collections.emptyList();
        matchIndex = 0;
    }

    @Override
    public void close() {
        left.close();
        // right already closed after build
        index = null;
        currentLeft = null;
    }

    /** Left header followed by the right header without its join columns; null without headers. */
    @Override
    public Row header() {
        Row lh = left.header();
        Row rh = right.header();
        if (lh == null || rh == null) return null;
        return lh.concat(rh.select(rightKept));
    }

    /** Distinct keys in the build side; -1 before open. */
    public int distinctBuildKeys() { return index == null ? -1 : index.distinctKeys(); }

    static int[] keptColumns(int width, int[] dropped) {
        boolean[] drop = new boolean[width];
        for (int c : dropped) {
            if (c < 0 || c >= width) {
                throw new IllegalArgumentException("Join column " + c + " outside right width " + width);
            }
            if (drop[c]) throw new IllegalArgumentException("Duplicate right join column: " + c);
            drop[c] = true;
        }
        int[] kept = new int[width - dropped.length];
        int k = 0;
        for (int i = 0; i < width; i++) {
            if (!drop[i]) kept[k++] = i;
        }
        return kept;
    }
}
