package db.rangejoin.query;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

import db.rangejoin.range.Range;

public class JoinValidatorTest {

    private final JoinValidator validator = new JoinValidator();

    private static final List<List<Object>> PEOPLE = List.of(
        List.of("id", "name", "city"),
        List.of(1, "Ann", "Oslo"),
        List.of(2, "Ben", "Rome")
    );

    private static JoinColumns cols(int left, int right) {
        return new JoinColumns(ColumnSpec.of(left), ColumnSpec.of(right));
    }

    @Test
    void joinTypeDefaultsToInnerAndIgnoresCase() {
        assertEquals(JoinType.INNER, validator.validateJoinType(null).value());
        assertEquals(JoinType.LEFT, validator.validateJoinType("left").value());
        assertEquals(JoinType.INNER, validator.validateJoinType("Inner").value());

        Validation<JoinType> bad = validator.validateJoinType("outer");
        assertFalse(bad.isOk());
        assertEquals(ErrorKind.JOIN_TYPE, bad.error().kind());
        assertEquals("OUTER", bad.error().offendingValue());
        assertEquals(ErrorKind.Family.PARAMETER, bad.error().kind().family());
    }

    @Test
    void bareIntegerIsSingleColumnSpec() {
        JoinColumns c = validator.validateColumns(2, List.of(3)).value();
        assertEquals(List.of(2), c.left().oneBased());
        assertArrayEquals(new int[] {1}, c.left().zeroBased());
        assertArrayEquals(new int[] {2}, c.right().zeroBased());
    }

    @Test
    void integralDoublesAreAccepted() {
        JoinColumns c = validator.validateColumns(List.of(1.0, 3.0), List.of(2, 1)).value();
        assertEquals(List.of(1, 3), c.left().oneBased());
    }

    @Test
    void columnSpecFailures() {
        assertEquals(ErrorKind.LENGTH_MISMATCH, validator.validateColumns(1, List.of(1, 2)).error().kind());
        assertEquals(ErrorKind.EMPTY_SPEC, validator.validateColumns(List.of(), List.of()).error().kind());
        assertEquals(ErrorKind.EMPTY_SPEC, validator.validateColumns(null, null).error().kind());
        assertEquals(ErrorKind.DUPLICATE_COLUMN, validator.validateColumns(List.of(1, 1), List.of(1, 2)).error().kind());
        assertEquals(ErrorKind.INVALID_BOUNDS, validator.validateColumns(0, 1).error().kind());
        assertEquals(ErrorKind.INVALID_BOUNDS, validator.validateColumns(1, -3).error().kind());
        assertEquals(ErrorKind.NON_INTEGER, validator.validateColumns(1.5, 1).error().kind());
        assertEquals(ErrorKind.NON_INTEGER, validator.validateColumns("1", 1).error().kind());
    }

    @Test
    void nonIntegerReportsValueAndPosition() {
        JoinError e = validator.validateColumns(List.of(1, "b"), List.of(1, 2)).error();
        assertEquals(ErrorKind.NON_INTEGER, e.kind());
        assertEquals(JoinValidator.LEFT_COLUMNS, e.parameter());
        assertEquals("b", e.offendingValue());
        assertEquals(2, e.position());

        JoinError dup = validator.validateColumns(List.of(1, 2), List.of(4, 4)).error();
        assertEquals(JoinValidator.RIGHT_COLUMNS, dup.parameter());
        assertEquals(2, dup.position());
    }

    @Test
    void rangeShapeFailures() {
        JoinColumns c = cols(1, 1);
        assertEquals(ErrorKind.NOT_A_RANGE, validator.validateRanges("A1:C3", PEOPLE, c, true).error().kind());
        assertEquals(JoinValidator.RIGHT_RANGE,
            validator.validateRanges(PEOPLE, List.of("a", "b"), c, true).error().parameter());
        assertEquals(ErrorKind.EMPTY_RANGE, validator.validateRanges(List.of(), PEOPLE, c, true).error().kind());
        assertEquals(ErrorKind.EMPTY_RANGE, validator.validateRanges(PEOPLE, List.of(List.of()), c, true).error().kind());

        List<List<Object>> blank = List.of(List.of("", ""), List.of("", ""));
        JoinError afterTrim = validator.validateRanges(PEOPLE, blank, c, true).error();
        assertEquals(ErrorKind.EMPTY_AFTER_TRIM, afterTrim.kind());
        assertEquals(JoinValidator.RIGHT_RANGE, afterTrim.parameter());
        assertEquals(ErrorKind.Family.RANGE, afterTrim.kind().family());
    }

    @Test
    void irregularRowsAreReported() {
        List<List<Object>> jagged = List.of(List.of("id", "n"), List.of("1"));
        JoinError e = validator.validateRanges(jagged, PEOPLE, cols(1, 1), true).error();
        assertEquals(ErrorKind.IRREGULAR_RANGE, e.kind());
        assertEquals(2, e.position());
        assertEquals(1, e.offendingValue());
        assertEquals(2, e.limit());
    }

    @Test
    void columnBeyondTrimmedWidth() {
        List<List<Object>> padded = List.of(
            Arrays.asList("id", "name", "city", "", ""),
            Arrays.asList(1, "Ann", "Oslo", "", "")
        );
        JoinError e = validator.validateRanges(PEOPLE, padded, cols(1, 5), true).error();
        assertEquals(ErrorKind.COLUMN_OUT_OF_BOUNDS, e.kind());
        assertEquals(JoinValidator.RIGHT_COLUMNS, e.parameter());
        assertEquals(5, e.offendingValue());
        assertEquals(3, e.limit());
        assertTrue(e.message().contains("3"));
    }

    @Test
    void headerOnlyRangeHasInsufficientRows() {
        List<List<Object>> headerOnly = List.of(List.of("id", "x"), List.of("", ""));
        JoinError e = validator.validateRanges(PEOPLE, headerOnly, cols(1, 1), true).error();
        assertEquals(ErrorKind.INSUFFICIENT_ROWS, e.kind());
        assertEquals(JoinValidator.RIGHT_RANGE, e.parameter());

        // without a header the single row is data
        Validation<Range[]> ok = validator.validateRanges(PEOPLE, headerOnly, cols(1, 1), false);
        assertTrue(ok.isOk());
        assertEquals(1, ok.value()[1].height());
    }

    @Test
    void checksRunInOrderAndStopAtFirstFailure() {
        // bad join type wins over bad columns and bad ranges
        Validation<ValidatedJoin> v = validator.validate("nope", null, 0, List.of(1, 2), "cross", true);
        assertEquals(ErrorKind.JOIN_TYPE, v.error().kind());
        // bad columns win over bad ranges
        v = validator.validate("nope", null, 0, 1, "left", true);
        assertEquals(ErrorKind.INVALID_BOUNDS, v.error().kind());
        // left range checked before right
        v = validator.validate("nope", 42, 1, 1, null, true);
        assertEquals(JoinValidator.LEFT_RANGE, v.error().parameter());
    }

    @Test
    void successfulValidationCarriesTrimmedRanges() {
        List<List<Object>> withTrailing = List.of(
            Arrays.asList("id", "score", ""),
            Arrays.asList(2, 90, ""),
            Arrays.asList("", "", "")
        );
        ValidatedJoin v = validator.validate(PEOPLE, withTrailing, 1, 1, "LEFT", true).value();
        assertEquals(2, v.right().width());
        assertEquals(2, v.right().height());
        assertEquals(JoinType.LEFT, v.spec().joinType());
        assertTrue(v.spec().hasHeader());
    }
}
