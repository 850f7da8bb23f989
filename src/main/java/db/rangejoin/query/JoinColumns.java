package db.rangejoin.query;

// Paired join columns; both sides have the same arity.
public record JoinColumns(ColumnSpec left, ColumnSpec right) {}
