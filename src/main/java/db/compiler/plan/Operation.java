package db.compiler.plan;

import java.util.List;

import db.compiler.ir.IrExpr;
import db.compiler.query.SortDirection;

/**
 * One relational step of a plan. Plans apply them in the order Filter, Project, Distinct, Sort, Limit.
 */
public sealed interface Operation permits Operation.Filter, Operation.Project, Operation.Distinct,
        Operation.Sort, Operation.Limit {

    /** Keeps rows for which the predicate holds. */
    record Filter(IrExpr predicate) implements Operation {
    }

    /**
     * Output columns. {@link #all()} keeps every source column in source order; otherwise
     * exactly the listed columns, in order, duplicates kept.
     */
    record Project(boolean allColumns, List<String> columns) implements Operation {
        public Project {
            columns = List.copyOf(columns);
        }

        public static Project all() {
            return new Project(true, List.of());
        }

        public static Project of(List<String> columns) {
            if (columns.isEmpty()) throw new IllegalArgumentException("explicit projection needs at least one column");
            return new Project(false, columns);
        }
    }

    /** Drops rows whose projected values repeat an earlier row; the first one is kept. */
    record Distinct() implements Operation {
    }

    /**
     * Stable sort keyed on a column of the source (pre-projection) row, so the key
     * need not be among the projected columns.
     */
    record Sort(String sourceColumn, SortDirection direction) implements Operation {
    }

    /** Skips {@code offset} rows then keeps at most {@code count}. */
    record Limit(int count, int offset) implements Operation {
    }
}
