package db.rangejoin.cli;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

import db.rangejoin.range.Range;

public class TablePrinterTest {

    private static String render(Range range, boolean hasHeader) {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        TablePrinter.print(range, hasHeader, new PrintStream(buf, true, StandardCharsets.UTF_8));
        return buf.toString(StandardCharsets.UTF_8);
    }

    @Test
    void printsHeaderRowsAndNulls() {
        Range r = Range.of(
            new Object[] {"id", "n", "m"},
            new Object[] {"1", "a", null},
            new Object[] {"2", "b", "x"}
        );
        String[] lines = render(r, true).split("\\R");
        assertEquals("+----+---+------+", lines[0]);
        assertEquals("| id | n | m    |", lines[1]);
        assertEquals("| 1  | a | NULL |", lines[3]);
        assertEquals("| 2  | b | x    |", lines[4]);
        assertEquals("(2 row(s))", lines[6]);
    }

    @Test
    void generatedHeadersWithoutHeaderRow() {
        Range r = Range.of(new Object[] {2.0, true});
        String out = render(r, false);
        assertTrue(out.contains("| col1 | col2 |"));
        assertTrue(out.contains("| 2    | true |"));
        assertTrue(out.contains("(1 row(s))"));
    }

    @Test
    void emptyResult() {
        assertEquals("(0 row(s))", render(new Range(java.util.List.of()), false).trim());
    }
}
