package db.rangejoin.query;

/**
 * A single validation failure.
 * position: 1-based position inside a column spec or row index inside a range, null when not applicable.
 * limit: the bound that was violated (range width for out-of-bounds columns), null when not applicable.
 */
public record JoinError(ErrorKind kind, String parameter, Object offendingValue,
                        Integer position, Integer limit, String message) {

    public static JoinError of(ErrorKind kind, String parameter, Object offendingValue, String message) {
        return new JoinError(kind, parameter, offendingValue, null, null, message);
    }

    public static JoinError at(ErrorKind kind, String parameter, Object offendingValue, int position, String message) {
        return new JoinError(kind, parameter, offendingValue, position, null, message);
    }

    @Override
    public String toString() { return kind + " [" + parameter + "]: " + message; }
}
