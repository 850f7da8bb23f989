package db.rangejoin.query;

/**
 * Join options: join type (INNER when not given) and whether both ranges start with a header row.
 */
public record JoinSpec(JoinType joinType, boolean hasHeader) {
    public JoinSpec {
        if (joinType == null) joinType = JoinType.INNER;
    }
}
