package db.compiler.exec;

/**
 * Minimal predicate interface evaluated against a Row.
 */
public interface Predicate {
    boolean test(Row row);
}
