package db.compiler.query;

import db.compiler.catalog.Catalog;
import db.compiler.catalog.Table;
import db.compiler.exec.QueryExecutor;
import db.compiler.exec.UnknownTableException;

/**
 * Processor combining compilation and execution.
 * Holds no mutable state, so one instance can serve concurrent queries.
 */
public class QueryProcessor {
    private final QueryCompiler compiler = new QueryCompiler();
    private final QueryExecutor executor = new QueryExecutor();
    private final Catalog catalog;

    public QueryProcessor() {
        this(null);
    }

    public QueryProcessor(Catalog catalog) {
        this.catalog = catalog;
    }

    public CompiledQuery compile(String sql) {
        return compiler.compile(sql);
    }

    /**
     * Compiles and runs a query against the given table. The FROM name is not checked
     * against the table, so a compiled query can target any table with the needed columns.
     */
    public QueryResult compileAndRun(String sql, Table table) {
        if (table == null) throw new IllegalArgumentException("table must not be null");
        try {
            return new QueryResult.Success(run(sql, table));
        } catch (QueryException e) {
            return QueryResult.Failure.of(e);
        }
    }

    /** Throwing variant of {@link #compileAndRun}. */
    public Table run(String sql, Table table) {
        CompiledQuery compiled = compiler.compile(sql);
        return executor.execute(compiled.plan(), table);
    }

    /** Runs a query against the catalog table named in its FROM clause. */
    public QueryResult execute(String sql) {
        if (catalog == null) throw new IllegalStateException("no catalog configured");
        try {
            CompiledQuery compiled = compiler.compile(sql);
            Table table = catalog.getTable(compiled.plan().table());
            if (table == null) throw new UnknownTableException(compiled.plan().table());
            return new QueryResult.Success(executor.execute(compiled.plan(), table));
        } catch (QueryException e) {
            return QueryResult.Failure.of(e);
        }
    }
}
