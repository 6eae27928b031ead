package db.compiler.cli;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import db.compiler.catalog.Catalog;
import db.compiler.catalog.ColumnSchema;
import db.compiler.catalog.Table;
import db.compiler.config.EngineConfig;
import db.compiler.query.CompiledQuery;
import db.compiler.query.QueryException;
import db.compiler.query.QueryProcessor;
import db.compiler.query.QueryResult;

/**
 * Interactive query loop over the tables in a catalog.
 * <ul>
 *   <li>{@code exit} / {@code quit} leave the loop</li>
 *   <li>{@code .tables} lists loaded tables with their column types</li>
 *   <li>{@code .explain <query>} shows the plan without running it</li>
 *   <li>anything else is run as a query</li>
 * </ul>
 */
public class Shell {
    public static final String PROMPT = "sql> ";

    private final Catalog catalog;
    private final QueryProcessor processor;
    private final EngineConfig config;
    private final BufferedReader in;
    private final PrintWriter out;

    public Shell(Catalog catalog, EngineConfig config, BufferedReader in, PrintWriter out) {
        this.catalog = catalog;
        this.processor = new QueryProcessor(catalog);
        this.config = config;
        this.in = in;
        this.out = out;
    }

    public void run() throws IOException {
        while (true) {
            out.print(PROMPT);
            out.flush();
            String line = in.readLine();
            if (line == null) break;
            line = line.trim();
            if (line.equalsIgnoreCase("exit") || line.equalsIgnoreCase("quit")) {
                out.println("Bye");
                break;
            }
            if (line.isEmpty()) continue;
            handle(line);
            out.flush();
        }
        out.flush();
    }

    /** Handles one non-empty input line. */
    public void handle(String line) {
        String lower = line.toLowerCase(Locale.ROOT);
        if (lower.equals(".tables")) {
            listTables();
        } else if (lower.startsWith(".explain")) {
            explain(line.substring(".explain".length()).trim());
        } else if (line.startsWith(".")) {
            out.println("Unknown command: " + line);
        } else {
            runQuery(line);
        }
    }

    private void runQuery(String sql) {
        if (config.explain) {
            try {
                out.println(processor.compile(sql).plan().explain());
            } catch (QueryException e) {
                report(sql, QueryResult.Failure.of(e));
                return;
            }
        }
        report(sql, processor.execute(sql));
    }

    private void report(String sql, QueryResult result) {
        if (json()) {
            out.println(JsonRenderer.render(result));
        } else if (result instanceof QueryResult.Success s) {
            TablePrinter.print(s.table(), out, config.maxDisplayRows);
        } else {
            printFailure(sql, (QueryResult.Failure) result);
        }
    }

    private void explain(String sql) {
        if (sql.isEmpty()) {
            out.println("Usage: .explain <query>");
            return;
        }
        CompiledQuery compiled;
        try {
            compiled = processor.compile(sql);
        } catch (QueryException e) {
            report(sql, QueryResult.Failure.of(e));
            return;
        }
        if (json()) out.println(JsonRenderer.render(compiled));
        else out.println(compiled.plan().explain());
    }

    private void listTables() {
        if (catalog.allTables().isEmpty()) {
            out.println("(no tables loaded)");
            return;
        }
        for (Table t : catalog.allTables().values()) {
            List<String> cols = new ArrayList<>();
            for (ColumnSchema c : t.columns()) cols.add(c.name() + " " + c.type());
            out.println(t.name() + "(" + String.join(", ", cols) + ") " + t.rowCount() + " row(s)");
        }
    }

    private void printFailure(String sql, QueryResult.Failure f) {
        out.println("Error [" + f.stage() + "]: " + f.message());
        if (f.hasPosition()) out.println(QueryException.caret(sql, f.position()));
    }

    private boolean json() {
        return EngineConfig.FORMAT_JSON.equals(config.outputFormat);
    }
}
