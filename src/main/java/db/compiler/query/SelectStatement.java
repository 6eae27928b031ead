package db.compiler.query;

/**
 * Root of the AST for one query.
 * where, orderBy and limit are null when the clause is absent.
 */
public record SelectStatement(SelectList columns, Identifier table, BoolExpr where, OrderBy orderBy, LimitClause limit,
                              boolean distinct) {

    public SelectStatement(SelectList columns, Identifier table, BoolExpr where, OrderBy orderBy, LimitClause limit) {
        this(columns, table, where, orderBy, limit, false);
    }

    public SelectStatement(SelectList columns, Identifier table, BoolExpr where, OrderBy orderBy) {
        this(columns, table, where, orderBy, null, false);
    }
}
