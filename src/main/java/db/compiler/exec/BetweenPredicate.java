package db.compiler.exec;

import db.compiler.ir.IrValue;

/**
 * {@code column [NOT] BETWEEN low AND high}, bounds inclusive. Each bound compares the way
 * a single comparison with that literal would. A missing cell satisfies neither form.
 */
public class BetweenPredicate implements Predicate {
    private final int columnIndex;
    private final String columnName;
    private final IrValue low;
    private final IrValue high;
    private final boolean negated;

    public BetweenPredicate(int columnIndex, String columnName, IrValue low, IrValue high, boolean negated) {
        this.columnIndex = columnIndex;
        this.columnName = columnName;
        this.low = low;
        this.high = high;
        this.negated = negated;
    }

    @Override
    public boolean test(Row row) {
        Object v = row.values().get(columnIndex);
        if (v == null) return false;
        boolean inside = ComparisonPredicate.compareCell(columnName, v, low) >= 0
                && ComparisonPredicate.compareCell(columnName, v, high) <= 0;
        return negated != inside;
    }

    @Override
    public String toString() {
        return columnName + (negated ? " NOT BETWEEN " : " BETWEEN ")
                + ComparisonPredicate.literalText(low) + " AND " + ComparisonPredicate.literalText(high);
    }
}
