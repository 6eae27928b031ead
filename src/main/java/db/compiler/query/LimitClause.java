package db.compiler.query;

/** LIMIT count [OFFSET skip]; offset is null when absent. */
public record LimitClause(Literal.NumberLiteral count, Literal.NumberLiteral offset) {
}
