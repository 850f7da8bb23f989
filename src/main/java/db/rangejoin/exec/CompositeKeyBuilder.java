package db.rangejoin.exec;

import java.util.List;

import db.rangejoin.range.Cells;

/**
 * Builds the lookup key for a row from its join columns.
 * Each value is reduced to its canonical text form, so matching is by text:
 * the number 1 and the string "1" produce the same key.
 */
public final class CompositeKeyBuilder {
    // ASCII unit separator; does not occur in ordinary cell text
    public static final char SEPARATOR = '\u001F';

    public String buildKey(Row row, int[] columnIndexes) {
        return buildKey(row.values(), columnIndexes);
    }

    public String buildKey(List<?> values, int[] columnIndexes) {
        if (columnIndexes.length == 1) return Cells.canonical(values.get(columnIndexes[0]));
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < columnIndexes.length; i++) {
            if (i > 0) sb.append(SEPARATOR);
            sb.append(Cells.canonical(values.get(columnIndexes[i])));
        }
        return sb.toString();
    }
}
