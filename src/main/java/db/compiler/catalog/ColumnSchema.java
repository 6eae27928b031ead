package db.compiler.catalog;

// Immutable data carrier for a table column.
public record ColumnSchema(String name, DataType type) {}
