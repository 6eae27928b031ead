package db.compiler.exec;

import java.util.ArrayList;
import java.util.List;

import db.compiler.catalog.ColumnSchema;
import db.compiler.storage.Record;

/**
 * Projection operator: selects columns from child rows in the requested order.
 * Keeps the child row's origin so a later sort can still key on dropped columns.
 */
public class ProjectionOperator implements Operator {
    private final Operator child;
    private final int[] columnIndexes; // indices to keep in output order
    private final List<ColumnSchema> projectedSchema;

    public ProjectionOperator(Operator child, int[] columnIndexes) {
        this.child = child;
        this.columnIndexes = columnIndexes.clone();
        List<ColumnSchema> childSchema = child.schema();
        List<ColumnSchema> out = new ArrayList<>(columnIndexes.length);
        for (int idx : columnIndexes) out.add(childSchema.get(idx));
        this.projectedSchema = List.copyOf(out);
    }

    /**
     * Build a ProjectionOperator by resolving column names against child schema.
     * Names may repeat; each occurrence becomes an output column.
     */
    public static ProjectionOperator forColumnNames(Operator child, List<String> columnNames) {
        if (columnNames == null || columnNames.isEmpty()) throw new IllegalArgumentException("columnNames must be non-empty");
        List<ColumnSchema> childSchema = child.schema();
        int[] idxs = new int[columnNames.size()];
        for (int i = 0; i < columnNames.size(); i++) {
            String name = columnNames.get(i);
            int found = -1;
            for (int j = 0; j < childSchema.size(); j++) {
                if (childSchema.get(j).name().equals(name)) { found = j; break; }
            }
            if (found == -1) throw new UnknownColumnException(name);
            idxs[i] = found;
        }
        return new ProjectionOperator(child, idxs);
    }

    /** Identity projection: every child column in its original order. */
    public static ProjectionOperator allColumns(Operator child) {
        int[] idxs = new int[child.schema().size()];
        for (int i = 0; i < idxs.length; i++) idxs[i] = i;
        return new ProjectionOperator(child, idxs);
    }

    @Override
    public void open() { child.open(); }

    @Override
    public Row next() {
        Row r = child.next();
        if (r == null) return null;
        List<Object> src = r.values();
        List<Object> projected = new ArrayList<>(columnIndexes.length);
        for (int idx : columnIndexes) {
            projected.add(src.get(idx));
        }
        return Row.derived(new Record(projected), projectedSchema, r.origin());
    }

    @Override
    public void close() { child.close(); }

    @Override
    public List<ColumnSchema> schema() { return projectedSchema; }
}
