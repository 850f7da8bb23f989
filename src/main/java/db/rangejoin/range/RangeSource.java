package db.rangejoin.range;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A range as it arrives at the join boundary: either a raw 2D grid or an object
 * exposing a value accessor. Both resolve to plain rows before validation.
 */
public interface RangeSource {

    /** Raw value behind this source, not yet checked for grid shape. */
    Object rawValues();

    static RangeSource of(Object value) {
        if (value instanceof RangeSource) return (RangeSource) value;
        return new RawGrid(value);
    }

    /**
     * Rows of this source, or null when the value is not a list of rows
     * (rows may be lists or arrays).
     */
    default List<List<Object>> resolve() {
        Object raw = rawValues();
        List<?> outer;
        if (raw instanceof List) {
            outer = (List<?>) raw;
        } else if (raw instanceof Object[]) {
            outer = Arrays.asList((Object[]) raw);
        } else {
            return null;
        }
        List<List<Object>> rows = new ArrayList<>(outer.size());
        for (Object r : outer) {
            if (r instanceof List) {
                rows.add(new ArrayList<>((List<?>) r));
            } else if (r instanceof Object[]) {
                rows.add(new ArrayList<>(Arrays.asList((Object[]) r)));
            } else {
                return null;
            }
        }
        return rows;
    }
}
