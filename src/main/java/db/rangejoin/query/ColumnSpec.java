package db.rangejoin.query;

import java.util.List;

// Validated join columns of one side, 1-based as given by the caller.
public record ColumnSpec(List<Integer> oneBased) {
    public ColumnSpec {
        oneBased = List.copyOf(oneBased);
    }

    public static ColumnSpec of(Integer... columns) { return new ColumnSpec(List.of(columns)); }

    public int size() { return oneBased.size(); }

    public int[] zeroBased() {
        int[] out = new int[oneBased.size()];
        for (int i = 0; i < out.length; i++) out[i] = oneBased.get(i) - 1;
        return out;
    }
}
