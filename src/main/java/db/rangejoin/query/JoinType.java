package db.rangejoin.query;

/**
 * Supported join types
 */
public enum JoinType {
    INNER,
    LEFT;
}
