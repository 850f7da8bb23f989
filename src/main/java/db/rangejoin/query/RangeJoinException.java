package db.rangejoin.query;

/**
 * Raised by {@link RangeJoin} when the call's arguments fail validation.
 */
public class RangeJoinException extends IllegalArgumentException {
    private final JoinError error;

    public RangeJoinException(JoinError error) {
        super(error.message());
        this.error = error;
    }

    public JoinError error() { return error; }
    public ErrorKind kind() { return error.kind(); }
}
