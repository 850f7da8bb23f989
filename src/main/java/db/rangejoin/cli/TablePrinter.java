package db.rangejoin.cli;

import java.io.PrintStream;
import java.util.List;

import db.rangejoin.range.Cells;
import db.rangejoin.range.Range;

/**
 * Simple ASCII table printer for join results.
 * Uses the range's first row as header when the join was headed.
 */
public final class TablePrinter {
    private TablePrinter() {}

    public static void print(Range range, boolean hasHeader) {
        print(range, hasHeader, System.out);
    }

    public static void print(Range range, boolean hasHeader, PrintStream out) {
        int headerRows = hasHeader && range.height() > 0 ? 1 : 0;
        int dataRows = range.height() - headerRows;
        int colCount = range.width();
        if (colCount == 0) {
            out.println("(" + dataRows + " row(s))");
            return;
        }
        String[] headers = new String[colCount];
        for (int i = 0; i < colCount; i++) {
            headers[i] = headerRows == 1 ? text(range.row(0).get(i)) : ("col" + (i + 1));
        }
        int[] widths = new int[colCount];
        for (int i = 0; i < colCount; i++) widths[i] = headers[i].length();
        for (int r = headerRows; r < range.height(); r++) {
            List<Object> vals = range.row(r);
            for (int i = 0; i < colCount; i++) {
                String s = text(vals.get(i));
                if (s.length() > widths[i]) widths[i] = s.length();
            }
        }
        String divLine = buildDivider(widths);
        out.println(divLine);
        out.println(buildLine(headers, widths));
        out.println(divLine);
        for (int r = headerRows; r < range.height(); r++) {
            List<Object> vals = range.row(r);
            String[] cells = new String[colCount];
            for (int i = 0; i < colCount; i++) cells[i] = text(vals.get(i));
            out.println(buildLine(cells, widths));
        }
        out.println(divLine);
        out.println("(" + dataRows + " row(s))");
    }

    private static String text(Object v) {
        return v == null ? "NULL" : Cells.canonical(v);
    }

    private static String buildDivider(int[] widths) {
        StringBuilder divider = new StringBuilder();
        divider.append('+');
        for (int w : widths) {
            for (int k = 0; k < w + 2; k++) divider.append('-');
            divider.append('+');
        }
        return divider.toString();
    }

    private static String buildLine(String[] cells, int[] widths) {
        StringBuilder sb = new StringBuilder();
        sb.append('|');
        for (int i = 0; i < cells.length; i++) {
            sb.append(' ').append(pad(cells[i], widths[i])).append(' ').append('|');
        }
        return sb.toString();
    }

    private static String pad(String s, int width) {
        if (s.length() >= width) return s;
        StringBuilder sb = new StringBuilder(width);
        sb.append(s);
        for (int i = s.length(); i < width; i++) sb.append(' ');
        return sb.toString();
    }
}
