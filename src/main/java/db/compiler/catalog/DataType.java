package db.compiler.catalog;

/**
 * Column data types inferred when a table is loaded
 */
public enum DataType {
    NUMBER,
    STRING;
}
