package db.compiler.ir;

import java.util.List;

/**
 * Normalized, schema-agnostic form of a SELECT.
 * columns is empty when allColumns is set; filter, ordering and limit may be null.
 */
public record IrQuery(String op, boolean allColumns, List<String> columns, String table,
                      IrExpr filter, IrOrdering ordering, IrLimit limit, boolean distinct) {
    public static final String SELECT = "select";

    public IrQuery {
        columns = List.copyOf(columns);
        if (allColumns && !columns.isEmpty()) {
            throw new IllegalArgumentException("allColumns query must not name columns");
        }
    }

    public IrQuery(String op, boolean allColumns, List<String> columns, String table,
                   IrExpr filter, IrOrdering ordering, IrLimit limit) {
        this(op, allColumns, columns, table, filter, ordering, limit, false);
    }
}
