package db.compiler.exec;

/** {@code column IS NULL} / {@code column IS NOT NULL}: tests for a missing cell. */
public class IsNullPredicate implements Predicate {
    private final int columnIndex;
    private final String columnName;
    private final boolean negated;

    public IsNullPredicate(int columnIndex, String columnName, boolean negated) {
        this.columnIndex = columnIndex;
        this.columnName = columnName;
        this.negated = negated;
    }

    @Override
    public boolean test(Row row) {
        boolean missing = row.values().get(columnIndex) == null;
        return negated != missing;
    }

    @Override
    public String toString() {
        return columnName + (negated ? " IS NOT NULL" : " IS NULL");
    }
}
