package db.compiler.exec;

/** Column referenced by a filter, projection or sort is not in the table schema. */
public class UnknownColumnException extends QueryRuntimeException {
    private final String name;

    public UnknownColumnException(String name) {
        super("Unknown column: " + name);
        this.name = name;
    }

    public String name() { return name; }
}
