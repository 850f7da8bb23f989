package db.rangejoin.cli;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line options of the join tool, parsed from --key=value arguments.
 */
public class CliConfig {
    public enum Format { TABLE, JSON }

    public final Path left;
    public final Path right;
    public final List<Object> leftColumns;
    public final List<Object> rightColumns;
    public final String joinType;
    public final boolean hasHeader;
    public final Format format;
    public final Path out;

    public CliConfig(Path left, Path right, List<Object> leftColumns, List<Object> rightColumns,
                     String joinType, boolean hasHeader, Format format, Path out) {
        this.left = left;
        this.right = right;
        this.leftColumns = leftColumns;
        this.rightColumns = rightColumns;
        this.joinType = joinType;
        this.hasHeader = hasHeader;
        this.format = format;
        this.out = out;
    }

    public static CliConfig fromArgs(String[] args) {
        Path left = null;
        Path right = null;
        List<Object> leftCols = null;
        List<Object> rightCols = null;
        String joinType = null;
        boolean hasHeader = true;
        Format format = Format.TABLE;
        Path out = null;

        for (String a : args) {
            if (a == null) continue;
            String s = a.trim();
            if (s.startsWith("--left=")) {
                left = Paths.get(s.substring("--left=".length()));
            } else if (s.startsWith("--right=")) {
                right = Paths.get(s.substring("--right=".length()));
            } else if (s.startsWith("--left-cols=")) {
                leftCols = parseColumns(s.substring("--left-cols=".length()));
            } else if (s.startsWith("--right-cols=")) {
                rightCols = parseColumns(s.substring("--right-cols=".length()));
            } else if (s.startsWith("--type=")) {
                joinType = s.substring("--type=".length());
            } else if (s.equals("--no-header")) {
                hasHeader = false;
            } else if (s.startsWith("--format=")) {
                String f = s.substring("--format=".length());
                format = f.equalsIgnoreCase("json") ? Format.JSON : Format.TABLE;
            } else if (s.startsWith("--out=")) {
                out = Paths.get(s.substring("--out=".length()));
                format = Format.JSON;
            } else {
                throw new IllegalArgumentException("Unknown argument: " + s);
            }
        }
        return new CliConfig(left, right, leftCols, rightCols, joinType, hasHeader, format, out);
    }

    /** Names of required options that were not given. */
    public List<String> missing() {
        List<String> m = new ArrayList<>();
        if (left == null) m.add("--left");
        if (right == null) m.add("--right");
        if (leftColumns == null) m.add("--left-cols");
        if (rightColumns == null) m.add("--right-cols");
        return m;
    }

    // "1,3" -> [1, 3]; tokens that are not numbers are kept as text for validation to report
    static List<Object> parseColumns(String raw) {
        List<Object> out = new ArrayList<>();
        for (String part : raw.split(",")) {
            String t = part.trim();
            if (t.isEmpty()) continue;
            if (t.matches("-?\\d+")) {
                try { out.add(Integer.parseInt(t)); } catch (NumberFormatException e) { out.add(t); }
            } else {
                out.add(t);
            }
        }
        return out;
    }

    public static String usage() {
        return "Usage: range-join --left=<file.json> --right=<file.json> --left-cols=1[,2...] --right-cols=1[,2...]\n"
            + "                  [--type=INNER|LEFT] [--no-header] [--format=table|json] [--out=<file.json>]";
    }
}
