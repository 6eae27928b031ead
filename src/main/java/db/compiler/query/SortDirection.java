package db.compiler.query;

public enum SortDirection {
    ASC,
    DESC
}
