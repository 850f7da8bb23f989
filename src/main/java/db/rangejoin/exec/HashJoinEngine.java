package db.rangejoin.exec;

import java.util.ArrayList;
import java.util.List;

import db.rangejoin.query.JoinType;
import db.rangejoin.range.Range;

/**
 * Runs one join over two rectangular ranges and materializes the result.
 * Header rows (when present) are excluded from key computation and combined once at the top.
 * Holds no state between calls.
 */
public class HashJoinEngine {

    /**
     * @param leftCols0  0-based join columns of the left range
     * @param rightCols0 0-based join columns of the right range, paired with leftCols0
     * @return header row (if any) followed by the joined rows in left scan order
     */
    public Range join(Range left, Range right, int[] leftCols0, int[] rightCols0,
                      JoinType joinType, boolean hasHeader) {
        if (left == null || right == null) throw new IllegalArgumentException("left and right ranges are required");
        for (int c : leftCols0) {
            if (c < 0 || c >= left.width()) {
                throw new IllegalArgumentException("Join column " + c + " outside left width " + left.width());
            }
        }
        RangeScanOperator leftScan = new RangeScanOperator(left, hasHeader);
        RangeScanOperator rightScan = new RangeScanOperator(right, hasHeader);
        HashJoinOperator join = new HashJoinOperator(leftScan, rightScan, leftCols0, rightCols0,
            joinType, right.width());

        List<List<Object>> out = new ArrayList<>();
        Row header = join.header();
        if (header != null) out.add(header.values());
        join.open();
        try {
            Row row;
            while ((row = join.next()) != null) out.add(row.values());
        } finally {
            join.close();
        }
        return new Range(out);
    }
}
