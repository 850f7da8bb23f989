package db.rangejoin.query;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import db.rangejoin.range.Range;
import db.rangejoin.range.RangeSource;
import db.rangejoin.range.RangeTrimmer;

/**
 * Checks join arguments before any join work starts.
 * Every step returns a {@link Validation}; the first failure short-circuits the rest.
 * Range checks run phase by phase, left before right within each phase.
 */
public class JoinValidator {
    public static final String LEFT_RANGE = "left_range";
    public static final String RIGHT_RANGE = "right_range";
    public static final String LEFT_COLUMNS = "left_columns";
    public static final String RIGHT_COLUMNS = "right_columns";
    public static final String JOIN_TYPE = "join_type";

    private final RangeTrimmer trimmer;

    public JoinValidator() { this(new RangeTrimmer()); }

    public JoinValidator(RangeTrimmer trimmer) {
        this.trimmer = trimmer;
    }

    /**
     * Full validation in call order: join type, column specs, ranges.
     */
    public Validation<ValidatedJoin> validate(Object leftRange, Object rightRange,
                                              Object leftColumns, Object rightColumns,
                                              String joinType, boolean hasHeader) {
        Validation<JoinType> type = validateJoinType(joinType);
        if (!type.isOk()) return type.propagate();
        Validation<JoinColumns> columns = validateColumns(leftColumns, rightColumns);
        if (!columns.isOk()) return columns.propagate();
        Validation<Range[]> ranges = validateRanges(leftRange, rightRange, columns.value(), hasHeader);
        if (!ranges.isOk()) return ranges.propagate();
        Range[] r = ranges.value();
        return Validation.ok(new ValidatedJoin(r[0], r[1], columns.value(), new JoinSpec(type.value(), hasHeader)));
    }

    public Validation<JoinType> validateJoinType(String joinType) {
        String normalized = (joinType == null ? JoinType.INNER.name() : joinType).toUpperCase(Locale.ROOT);
        return switch (normalized) {
            case "INNER" -> Validation.ok(JoinType.INNER);
            case "LEFT" -> Validation.ok(JoinType.LEFT);
            default -> Validation.fail(JoinError.of(ErrorKind.JOIN_TYPE, JOIN_TYPE, normalized,
                "Unsupported join type: " + normalized + " (expected INNER or LEFT)"));
        };
    }

    public Validation<JoinColumns> validateColumns(Object leftColumns, Object rightColumns) {
        List<?> left = asList(leftColumns);
        List<?> right = asList(rightColumns);
        if (left.size() != right.size()) {
            return Validation.fail(new JoinError(ErrorKind.LENGTH_MISMATCH, RIGHT_COLUMNS, right.size(), null, left.size(),
                "left_columns has " + left.size() + " column(s) but right_columns has " + right.size()));
        }
        if (left.isEmpty()) {
            return Validation.fail(JoinError.of(ErrorKind.EMPTY_SPEC, LEFT_COLUMNS, leftColumns,
                "left_columns and right_columns must name at least one column"));
        }
        Validation<List<Long>> l = integers(LEFT_COLUMNS, left);
        if (!l.isOk()) return l.propagate();
        Validation<List<Long>> r = integers(RIGHT_COLUMNS, right);
        if (!r.isOk()) return r.propagate();

        JoinError dup = firstDuplicate(LEFT_COLUMNS, l.value());
        if (dup == null) dup = firstDuplicate(RIGHT_COLUMNS, r.value());
        if (dup != null) return Validation.fail(dup);

        JoinError bounds = firstBelowOne(LEFT_COLUMNS, l.value());
        if (bounds == null) bounds = firstBelowOne(RIGHT_COLUMNS, r.value());
        if (bounds != null) return Validation.fail(bounds);

        return Validation.ok(new JoinColumns(toSpec(l.value()), toSpec(r.value())));
    }

    /**
     * Resolves, trims and checks both ranges against already validated column specs.
     * Returns the trimmed ranges as {left, right}.
     */
    public Validation<Range[]> validateRanges(Object leftRange, Object rightRange,
                                              JoinColumns columns, boolean hasHeader) {
        List<List<Object>> leftRows = RangeSource.of(leftRange).resolve();
        if (leftRows == null) return notARange(LEFT_RANGE, leftRange);
        List<List<Object>> rightRows = RangeSource.of(rightRange).resolve();
        if (rightRows == null) return notARange(RIGHT_RANGE, rightRange);

        if (isEmpty(leftRows)) return Validation.fail(emptyRange(LEFT_RANGE));
        if (isEmpty(rightRows)) return Validation.fail(emptyRange(RIGHT_RANGE));

        Range left = trimmer.trim(leftRows);
        Range right = trimmer.trim(rightRows);
        if (left.isEmpty()) return Validation.fail(emptyAfterTrim(LEFT_RANGE));
        if (right.isEmpty()) return Validation.fail(emptyAfterTrim(RIGHT_RANGE));

        JoinError irregular = irregularRow(LEFT_RANGE, left);
        if (irregular == null) irregular = irregularRow(RIGHT_RANGE, right);
        if (irregular != null) return Validation.fail(irregular);

        JoinError bounds = outOfBounds(LEFT_COLUMNS, columns.left(), left.width());
        if (bounds == null) bounds = outOfBounds(RIGHT_COLUMNS, columns.right(), right.width());
        if (bounds != null) return Validation.fail(bounds);

        int needed = hasHeader ? 2 : 1;
        if (left.height() < needed) return Validation.fail(insufficientRows(LEFT_RANGE, left, hasHeader));
        if (right.height() < needed) return Validation.fail(insufficientRows(RIGHT_RANGE, right, hasHeader));

        return Validation.ok(new Range[] { left, right });
    }

    // A bare value is a one-element spec; null is an empty one
    private static List<?> asList(Object columns) {
        if (columns == null) return List.of();
        if (columns instanceof List) return (List<?>) columns;
        if (columns instanceof Object[]) return Arrays.asList((Object[]) columns);
        if (columns instanceof int[]) {
            List<Integer> out = new ArrayList<>();
            for (int c : (int[]) columns) out.add(c);
            return out;
        }
        return List.of(columns);
    }

    private static Validation<List<Long>> integers(String parameter, List<?> values) {
        List<Long> out = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++) {
            Object v = values.get(i);
            Long n = integralValue(v);
            if (n == null) {
                return Validation.fail(JoinError.at(ErrorKind.NON_INTEGER, parameter, v, i + 1,
                    parameter + " value at position " + (i + 1) + " is not an integer: " + v));
            }
            out.add(n);
        }
        return Validation.ok(out);
    }

    // JSON numbers arrive as Double, so integral floating values count as integers
    private static Long integralValue(Object v) {
        if (v instanceof Integer || v instanceof Long || v instanceof Short || v instanceof Byte) {
            return ((Number) v).longValue();
        }
        if (v instanceof Double || v instanceof Float) {
            double d = ((Number) v).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d) || d != Math.rint(d)) return null;
            if (d > Long.MAX_VALUE || d < Long.MIN_VALUE) return d > 0 ? Long.MAX_VALUE : Long.MIN_VALUE;
            return (long) d;
        }
        if (v instanceof BigInteger) return clamp(new BigDecimal((BigInteger) v));
        if (v instanceof BigDecimal) {
            BigDecimal d = (BigDecimal) v;
            if (d.signum() != 0 && d.stripTrailingZeros().scale() > 0) return null;
            return clamp(d);
        }
        return null;
    }

    private static Long clamp(BigDecimal d) {
        if (d.compareTo(BigDecimal.valueOf(Long.MAX_VALUE)) > 0) return Long.MAX_VALUE;
        if (d.compareTo(BigDecimal.valueOf(Long.MIN_VALUE)) < 0) return Long.MIN_VALUE;
        return d.longValue();
    }

    private static JoinError firstDuplicate(String parameter, List<Long> values) {
        Set<Long> seen = new HashSet<>();
        for (int i = 0; i < values.size(); i++) {
            if (!seen.add(values.get(i))) {
                return JoinError.at(ErrorKind.DUPLICATE_COLUMN, parameter, values.get(i), i + 1,
                    parameter + " contains column " + values.get(i) + " more than once");
            }
        }
        return null;
    }

    // Values beyond int range can never address a column either
    private static JoinError firstBelowOne(String parameter, List<Long> values) {
        for (int i = 0; i < values.size(); i++) {
            long v = values.get(i);
            if (v < 1 || v > Integer.MAX_VALUE) {
                return JoinError.at(ErrorKind.INVALID_BOUNDS, parameter, v, i + 1,
                    parameter + " value at position " + (i + 1) + " must be a positive column number: " + v);
            }
        }
        return null;
    }

    private static ColumnSpec toSpec(List<Long> values) {
        List<Integer> out = new ArrayList<>(values.size());
        for (long v : values) out.add((int) v);
        return new ColumnSpec(out);
    }

    private static boolean isEmpty(List<List<Object>> rows) {
        return rows.isEmpty() || rows.get(0).isEmpty();
    }

    private static <T> Validation<T> notARange(String parameter, Object value) {
        String type = value == null ? "null" : value.getClass().getSimpleName();
        return Validation.fail(JoinError.of(ErrorKind.NOT_A_RANGE, parameter, value,
            parameter + " is not a range (got " + type + ")"));
    }

    private static JoinError emptyRange(String parameter) {
        return JoinError.of(ErrorKind.EMPTY_RANGE, parameter, null, parameter + " is empty");
    }

    private static JoinError emptyAfterTrim(String parameter) {
        return JoinError.of(ErrorKind.EMPTY_AFTER_TRIM, parameter, null,
            parameter + " contains no values after removing trailing empty rows and columns");
    }

    private static JoinError irregularRow(String parameter, Range range) {
        int width = range.width();
        for (int i = 0; i < range.height(); i++) {
            int w = range.row(i).size();
            if (w != width) {
                return new JoinError(ErrorKind.IRREGULAR_RANGE, parameter, w, i + 1, width,
                    parameter + " row " + (i + 1) + " has " + w + " column(s), expected " + width);
            }
        }
        return null;
    }

    private static JoinError outOfBounds(String parameter, ColumnSpec spec, int width) {
        List<Integer> cols = spec.oneBased();
        for (int i = 0; i < cols.size(); i++) {
            if (cols.get(i) > width) {
                return new JoinError(ErrorKind.COLUMN_OUT_OF_BOUNDS, parameter, cols.get(i), i + 1, width,
                    parameter + " column " + cols.get(i) + " is out of bounds: range has " + width + " column(s)");
            }
        }
        return null;
    }

    private static JoinError insufficientRows(String parameter, Range range, boolean hasHeader) {
        String msg = hasHeader
            ? parameter + " has a header row but no data rows"
            : parameter + " has no data rows";
        return new JoinError(ErrorKind.INSUFFICIENT_ROWS, parameter, range.height(), null, hasHeader ? 2 : 1, msg);
    }
}
