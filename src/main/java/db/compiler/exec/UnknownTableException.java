package db.compiler.exec;

/** FROM names a table that is not loaded. */
public class UnknownTableException extends QueryRuntimeException {
    private final String name;

    public UnknownTableException(String name) {
        super("Unknown table: " + name);
        this.name = name;
    }

    public String name() { return name; }
}
