package db.compiler.exec;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import db.compiler.catalog.ColumnSchema;

/**
 * Drops rows whose values equal those of an earlier row; the first occurrence is kept,
 * so output order is input order.
 */
public class DistinctOperator implements Operator {
    private final Operator child;
    private Set<List<Object>> seen;

    public DistinctOperator(Operator child) {
        this.child = child;
    }

    @Override
    public void open() {
        child.open();
        seen = new HashSet<>();
    }

    @Override
    public Row next() {
        Row r;
        while ((r = child.next()) != null) {
            if (seen.add(r.values())) return r;
        }
        return null;
    }

    @Override
    public void close() {
        child.close();
        seen = null;
    }

    @Override
    public List<ColumnSchema> schema() { return child.schema(); }
}
