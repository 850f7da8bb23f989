package db.rangejoin.exec;

/**
 * Minimal physical operator interface
 */
public interface Operator {
    void open();
    Row next(); // returns next row or null when exhausted
    void close();

    /**
     * Header row for produced rows. Operators over headed input should override.
     * Returning null means there is no header.
     */
    default Row header() { return null; }
}
