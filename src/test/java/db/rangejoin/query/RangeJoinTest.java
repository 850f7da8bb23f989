package db.rangejoin.query;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

import db.rangejoin.exec.HashJoinEngine;
import db.rangejoin.range.AccessorGrid;
import db.rangejoin.range.Range;

public class RangeJoinTest {

    private final RangeJoin rangeJoin = new RangeJoin();

    private static final Object[][] LEFT = { {"id", "n"}, {"1", "a"}, {"2", "b"} };
    private static final Object[][] RIGHT = { {"id", "m"}, {"2", "x"}, {"3", "y"} };

    @Test
    void innerJoinKeepsMatchedRowsOnly() {
        Range out = rangeJoin.join(LEFT, RIGHT, 1, 1, "INNER", true);
        assertEquals(Range.of(
            new Object[] {"id", "n", "m"},
            new Object[] {"2", "b", "x"}
        ), out);
    }

    @Test
    void leftJoinPadsUnmatchedRowsWithNull() {
        Range out = rangeJoin.join(LEFT, RIGHT, 1, 1, "left", true);
        assertEquals(Range.of(
            new Object[] {"id", "n", "m"},
            new Object[] {"1", "a", null},
            new Object[] {"2", "b", "x"}
        ), out);
    }

    @Test
    void duplicateRightKeysEmitOneRowPerMatchInRightOrder() {
        Object[][] right = { {"id", "m"}, {"2", "x1"}, {"3", "y"}, {"2", "x2"} };
        Range out = rangeJoin.join(LEFT, right, 1, 1);
        assertEquals(Range.of(
            new Object[] {"id", "n", "m"},
            new Object[] {"2", "b", "x1"},
            new Object[] {"2", "b", "x2"}
        ), out);
    }

    @Test
    void duplicateKeysOnBothSidesGiveCrossProduct() {
        Object[][] left = { {"k", "l"}, {"a", "L1"}, {"a", "L2"}, {"b", "L3"} };
        Object[][] right = { {"k", "r"}, {"a", "R1"}, {"a", "R2"}, {"b", "R3"} };
        Range out = rangeJoin.join(left, right, 1, 1);
        // (a: 2x2) + (b: 1x1) = 5 data rows
        assertEquals(6, out.height());
        assertEquals(List.of("a", "L1", "R1"), out.row(1));
        assertEquals(List.of("a", "L1", "R2"), out.row(2));
        assertEquals(List.of("a", "L2", "R1"), out.row(3));
        assertEquals(List.of("a", "L2", "R2"), out.row(4));
        assertEquals(List.of("b", "L3", "R3"), out.row(5));
    }

    @Test
    void columnOutOfBoundsFailsBeforeAnyRowIsScanned() {
        HashJoinEngine failingEngine = new HashJoinEngine() {
            @Override
            public Range join(Range left, Range right, int[] l, int[] r, JoinType t, boolean h) {
                fail("engine must not run when validation fails");
                return null;
            }
        };
        RangeJoin guarded = new RangeJoin(new JoinValidator(), failingEngine);
        Object[][] three = { {"a", "b", "c"}, {1, 2, 3} };
        RangeJoinException e = assertThrows(RangeJoinException.class,
            () -> guarded.join(three, three, 1, 5, null, true));
        assertEquals(ErrorKind.COLUMN_OUT_OF_BOUNDS, e.kind());
        assertEquals(5, e.error().offendingValue());
        assertEquals(3, e.error().limit());
    }

    @Test
    void rightRangeEmptyAfterTrimFails() {
        Object[][] blank = { {"", ""}, {"", ""} };
        RangeJoinException e = assertThrows(RangeJoinException.class,
            () -> rangeJoin.join(LEFT, blank, 1, 1, "INNER", true));
        assertEquals(ErrorKind.EMPTY_AFTER_TRIM, e.kind());
        assertEquals(JoinValidator.RIGHT_RANGE, e.error().parameter());
        assertTrue(e instanceof IllegalArgumentException);
    }

    @Test
    void allArgumentsAbsentReturnsNull() {
        assertNull(rangeJoin.join(null, null, null, null, null, null));
        // any argument present means a real call
        assertThrows(RangeJoinException.class, () -> rangeJoin.join(null, null, null, null, "INNER", null));
    }

    @Test
    void explicitNoHeaderIsRespected() {
        Object[][] left = { {"1", "a"}, {"2", "b"} };
        Object[][] right = { {"2", "x"} };
        Range out = rangeJoin.join(left, right, 1, 1, "INNER", false);
        assertEquals(Range.of(new Object[] {"2", "b", "x"}), out);
    }

    @Test
    void numberAndTextWithSameDigitsMatch() {
        Object[][] left = { {"id", "n"}, {1.0, "a"}, {2, "b"} };
        Object[][] right = { {"id", "m"}, {"1", "x"}, {"2", "y"} };
        Range out = rangeJoin.join(left, right, 1, 1);
        assertEquals(3, out.height());
        assertEquals(List.of(1.0, "a", "x"), out.row(1));
        assertEquals(List.of(2, "b", "y"), out.row(2));
    }

    @Test
    void compositeKeysPairColumnsByPosition() {
        Object[][] left = { {"a", "b", "v"}, {"1", "x", "L1"}, {"1", "y", "L2"} };
        Object[][] right = { {"k2", "val", "k1"}, {"x", "R1", "1"}, {"y", "R2", "2"} };
        Range out = rangeJoin.join(left, right, List.of(1, 2), List.of(3, 1), "INNER", true);
        assertEquals(Range.of(
            new Object[] {"a", "b", "v", "val"},
            new Object[] {"1", "x", "L1", "R1"}
        ), out);
    }

    @Test
    void outputWidthDropsRightJoinColumnsAndTrailingBlanks() {
        Object[][] left = { {"id", "n", ""}, {"1", "a", ""}, {"", "", ""} };
        Object[][] right = { {"x", "id", "m"}, {"p", "1", "q"} };
        Range out = rangeJoin.join(left, right, 1, 2, "LEFT", true);
        // 2 left + 3 right - 1 join column
        assertEquals(4, out.width());
        assertEquals(Range.of(
            new Object[] {"id", "n", "x", "m"},
            new Object[] {"1", "a", "p", "q"}
        ), out);
    }

    @Test
    void accessorBackedRangesAreResolvedFirst() {
        AccessorGrid left = new AccessorGrid(() -> LEFT);
        AccessorGrid right = new AccessorGrid(() -> RIGHT);
        assertEquals(rangeJoin.join(LEFT, RIGHT, 1, 1), rangeJoin.join(left, right, 1, 1));
    }

    @Test
    void repeatedCallsProduceIdenticalOutput() {
        Range first = rangeJoin.join(LEFT, RIGHT, 1, 1, "LEFT", true);
        Range second = rangeJoin.join(LEFT, RIGHT, 1, 1, "LEFT", true);
        assertEquals(first, second);
        assertEquals(first.toString(), second.toString());
    }

    @Test
    void validateExposesErrorWithoutThrowing() {
        Validation<ValidatedJoin> v = rangeJoin.validate(LEFT, RIGHT, 1, 1, "FULL", true);
        assertFalse(v.isOk());
        assertEquals(ErrorKind.JOIN_TYPE, v.error().kind());
        assertThrows(RangeJoinException.class, v::orElseThrow);
        assertThrows(IllegalStateException.class, v::value);
    }

    @Test
    void innerJoinWithoutMatchesReturnsHeaderOnly() {
        Object[][] right = { {"id", "m"}, {"9", "z"} };
        Range out = rangeJoin.join(LEFT, right, 1, 1);
        assertEquals(Range.of(new Object[] {"id", "n", "m"}), out);
    }
}
