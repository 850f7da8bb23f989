package db.rangejoin.range;

// Plain 2D value (List of rows or Object[][]).
public record RawGrid(Object values) implements RangeSource {
    @Override
    public Object rawValues() { return values; }
}
