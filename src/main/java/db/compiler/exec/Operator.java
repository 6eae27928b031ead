package db.compiler.exec;

import java.util.List;

import db.compiler.catalog.ColumnSchema;

/**
 * Minimal physical operator interface
 */
public interface Operator {
    void open();
    Row next(); // returns next row or null when exhausted
    void close();

    /** Schema of the rows this operator produces. */
    List<ColumnSchema> schema();
}
