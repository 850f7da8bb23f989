package db.rangejoin.cli;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonIOException;
import com.google.gson.JsonSyntaxException;

import db.rangejoin.range.Range;

/**
 * Reads and writes ranges as JSON 2D arrays, e.g. [["id","name"],[1,"Alice"]].
 */
public final class RangeJson {
    private final Gson reader = new Gson();
    private final Gson writer = new GsonBuilder().serializeNulls().disableHtmlEscaping().create();

    /**
     * Parses a JSON document into a raw grid. Numbers become Double, null cells become "".
     * Anything other than an array of arrays is returned as parsed, for validation to reject.
     */
    public Object read(Path file) throws IOException {
        try (Reader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(in, file.toString());
        }
    }

    public Object read(Reader in, String sourceName) {
        Object parsed;
        try {
            parsed = reader.fromJson(in, Object.class);
        } catch (JsonSyntaxException | JsonIOException e) {
            throw new IllegalArgumentException("Malformed JSON in " + sourceName + ": " + e.getMessage(), e);
        }
        if (!(parsed instanceof List)) return parsed;
        List<Object> rows = new ArrayList<>();
        for (Object r : (List<?>) parsed) {
            if (!(r instanceof List)) {
                rows.add(r);
                continue;
            }
            List<Object> cells = new ArrayList<>();
            for (Object c : (List<?>) r) cells.add(c == null ? "" : c);
            rows.add(cells);
        }
        return rows;
    }

    public String toJson(Range range) {
        return writer.toJson(cellsForJson(range));
    }

    public void write(Range range, Writer out) {
        writer.toJson(cellsForJson(range), out);
    }

    public void write(Range range, Path file) throws IOException {
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            write(range, out);
        }
    }

    // Integral doubles go out without a fraction so 1 stays 1
    private static List<List<Object>> cellsForJson(Range range) {
        List<List<Object>> out = new ArrayList<>(range.height());
        for (List<Object> row : range.rows()) {
            List<Object> cells = new ArrayList<>(row.size());
            for (Object v : row) {
                if (v instanceof Double && isIntegral((Double) v)) {
                    cells.add(((Double) v).longValue());
                } else {
                    cells.add(v);
                }
            }
            out.add(cells);
        }
        return out;
    }

    private static boolean isIntegral(double d) {
        return !Double.isInfinite(d) && d == Math.rint(d) && Math.abs(d) < 9.007199254740992E15;
    }
}
