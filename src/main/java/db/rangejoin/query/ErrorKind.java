package db.rangejoin.query;

/**
 * Validation failures, grouped into parameter errors and range errors.
 */
public enum ErrorKind {
    JOIN_TYPE(Family.PARAMETER),
    LENGTH_MISMATCH(Family.PARAMETER),
    EMPTY_SPEC(Family.PARAMETER),
    NON_INTEGER(Family.PARAMETER),
    DUPLICATE_COLUMN(Family.PARAMETER),
    INVALID_BOUNDS(Family.PARAMETER),

    NOT_A_RANGE(Family.RANGE),
    EMPTY_RANGE(Family.RANGE),
    EMPTY_AFTER_TRIM(Family.RANGE),
    IRREGULAR_RANGE(Family.RANGE),
    COLUMN_OUT_OF_BOUNDS(Family.RANGE),
    INSUFFICIENT_ROWS(Family.RANGE);

    public enum Family { PARAMETER, RANGE }

    private final Family family;

    ErrorKind(Family family) { this.family = family; }

    public Family family() { return family; }
}
