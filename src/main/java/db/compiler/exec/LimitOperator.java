package db.compiler.exec;

import java.util.List;

import db.compiler.catalog.ColumnSchema;

/**
 * Skips the first {@code offset} child rows, then passes through at most {@code count}.
 */
public class LimitOperator implements Operator {
    private final Operator child;
    private final int count;
    private final int offset;
    private int skipped;
    private int emitted;

    public LimitOperator(Operator child, int count, int offset) {
        if (count < 0 || offset < 0) throw new IllegalArgumentException("count and offset must be non-negative");
        this.child = child;
        this.count = count;
        this.offset = offset;
    }

    @Override
    public void open() {
        child.open();
        skipped = 0;
        emitted = 0;
    }

    @Override
    public Row next() {
        if (emitted >= count) return null;
        while (skipped < offset) {
            if (child.next() == null) return null;
            skipped++;
        }
        Row r = child.next();
        if (r != null) emitted++;
        return r;
    }

    @Override
    public void close() { child.close(); }

    @Override
    public List<ColumnSchema> schema() { return child.schema(); }
}
