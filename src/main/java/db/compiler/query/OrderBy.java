package db.compiler.query;

public record OrderBy(Identifier column, SortDirection direction) {
}
