package db.compiler.exec;

import db.compiler.catalog.DataType;

/** A cell value cannot be coerced to the type of the literal it is compared with. */
public class TypeMismatchException extends QueryRuntimeException {
    private final String column;
    private final DataType expected;
    private final Object found;

    public TypeMismatchException(String column, DataType expected, Object found) {
        super("Type mismatch on column '" + column + "': expected " + expected + " but found "
                + (found instanceof String ? "'" + found + "'" : String.valueOf(found)));
        this.column = column;
        this.expected = expected;
        this.found = found;
    }

    public String column() { return column; }
    public DataType expected() { return expected; }
    public Object found() { return found; }
}
