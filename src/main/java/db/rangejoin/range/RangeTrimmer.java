package db.rangejoin.range;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes trailing blank rows, then trailing blank columns.
 * Interior blank cells are kept. Returns {@link Range#EMPTY} when nothing is left.
 */
public final class RangeTrimmer {

    public Range trim(Range range) {
        return trim(range.rows());
    }

    public Range trim(List<? extends List<?>> rows) {
        int lastRow = -1;
        for (int r = rows.size() - 1; r >= 0; r--) {
            if (!isBlankRow(rows.get(r))) { lastRow = r; break; }
        }
        if (lastRow < 0) return Range.EMPTY;
        List<? extends List<?>> kept = rows.subList(0, lastRow + 1);

        int maxWidth = 0;
        for (List<?> row : kept) maxWidth = Math.max(maxWidth, row.size());
        int lastCol = -1;
        for (int c = maxWidth - 1; c >= 0 && lastCol < 0; c--) {
            for (List<?> row : kept) {
                if (c < row.size() && !Cells.isBlank(row.get(c))) { lastCol = c; break; }
            }
        }
        if (lastCol < 0) return Range.EMPTY;

        List<List<?>> out = new ArrayList<>(kept.size());
        for (List<?> row : kept) {
            // jagged rows stay jagged so validation can report them
            out.add(row.subList(0, Math.min(lastCol + 1, row.size())));
        }
        return new Range(out);
    }

    private boolean isBlankRow(List<?> row) {
        for (Object v : row) {
            if (!Cells.isBlank(v)) return false;
        }
        return true;
    }
}
