package db.rangejoin;

import java.io.IOException;
import java.io.PrintStream;
import java.util.List;

import db.rangejoin.cli.CliConfig;
import db.rangejoin.cli.RangeJson;
import db.rangejoin.cli.TablePrinter;
import db.rangejoin.query.RangeJoin;
import db.rangejoin.query.RangeJoinException;
import db.rangejoin.range.Range;

public class Main {
    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Runs one join from the command line.
     * @return process exit code: 0 on success, 1 when the join fails, 2 on bad usage
     */
    public static int run(String[] args, PrintStream out, PrintStream err) {
        CliConfig cfg;
        try {
            cfg = CliConfig.fromArgs(args);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            err.println(CliConfig.usage());
            return 2;
        }
        List<String> missing = cfg.missing();
        if (!missing.isEmpty()) {
            err.println("Missing required argument(s): " + String.join(", ", missing));
            err.println(CliConfig.usage());
            return 2;
        }

        RangeJson json = new RangeJson();
        try {
            Object left = json.read(cfg.left);
            Object right = json.read(cfg.right);
            Range result = new RangeJoin().join(left, right, cfg.leftColumns, cfg.rightColumns,
                cfg.joinType, cfg.hasHeader);
            if (cfg.out != null) {
                json.write(result, cfg.out);
                out.println("Wrote " + result.height() + " row(s) to " + cfg.out);
            } else if (cfg.format == CliConfig.Format.JSON) {
                out.println(json.toJson(result));
            } else {
                TablePrinter.print(result, cfg.hasHeader, out);
            }
            return 0;
        } catch (RangeJoinException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("[Main] Failed reading or writing range file: " + e.getMessage());
            return 1;
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }
}

/* -------------------------------------------------------------------------
 * Example (students.json / enrollments.json hold JSON 2D arrays with a header row):
 *
 *   range-join --left=students.json --right=enrollments.json --left-cols=1 --right-cols=2
 *   range-join --left=students.json --right=enrollments.json --left-cols=1 --right-cols=2 --type=LEFT
 *   range-join --left=a.json --right=b.json --left-cols=1,2 --right-cols=3,1 --no-header --format=json
 * ------------------------------------------------------------------------- */
