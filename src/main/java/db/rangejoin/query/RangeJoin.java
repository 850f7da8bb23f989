package db.rangejoin.query;

import db.rangejoin.exec.HashJoinEngine;
import db.rangejoin.range.Range;

/**
 * SQL-style join of two ranges on one or more key columns.
 *
 * <pre>
 *   join(left_range, right_range, left_columns, right_columns [, join_type [, has_header]])
 * </pre>
 *
 * Ranges may be a {@link db.rangejoin.range.RangeSource}, a list of rows or an Object[][].
 * Columns are 1-based: a single number or a list of numbers, paired by position.
 * join_type is INNER (default) or LEFT, case-insensitive; has_header defaults to true.
 * The result keeps every left column, then the right columns that are not join columns.
 */
public class RangeJoin {
    private final JoinValidator validator;
    private final HashJoinEngine engine;

    public RangeJoin() {
        this(new JoinValidator(), new HashJoinEngine());
    }

    public RangeJoin(JoinValidator validator, HashJoinEngine engine) {
        this.validator = validator;
        this.engine = engine;
    }

    /**
     * @return the joined range, or null when every argument is null (blank preview)
     * @throws RangeJoinException when any argument fails validation; nothing is computed in that case
     */
    public Range join(Object leftRange, Object rightRange, Object leftColumns, Object rightColumns,
                      String joinType, Boolean hasHeader) {
        if (leftRange == null && rightRange == null && leftColumns == null && rightColumns == null
                && joinType == null && hasHeader == null) {
            return null;
        }
        return run(validate(leftRange, rightRange, leftColumns, rightColumns, joinType, hasHeader).orElseThrow());
    }

    public Range join(Object leftRange, Object rightRange, Object leftColumns, Object rightColumns) {
        return join(leftRange, rightRange, leftColumns, rightColumns, null, null);
    }

    public Validation<ValidatedJoin> validate(Object leftRange, Object rightRange, Object leftColumns,
                                              Object rightColumns, String joinType, Boolean hasHeader) {
        boolean header = hasHeader == null || hasHeader;
        return validator.validate(leftRange, rightRange, leftColumns, rightColumns, joinType, header);
    }

    public Range run(ValidatedJoin join) {
        return engine.join(join.left(), join.right(),
            join.columns().left().zeroBased(), join.columns().right().zeroBased(),
            join.spec().joinType(), join.spec().hasHeader());
    }
}
