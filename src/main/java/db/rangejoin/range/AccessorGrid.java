package db.rangejoin.range;

import java.util.function.Supplier;

/**
 * Range backed by an object that hands out its values on request,
 * e.g. {@code new AccessorGrid(sheetRange::getValues)}.
 */
public record AccessorGrid(Supplier<?> accessor) implements RangeSource {
    public AccessorGrid {
        if (accessor == null) throw new IllegalArgumentException("accessor must not be null");
    }

    @Override
    public Object rawValues() { return accessor.get(); }
}
