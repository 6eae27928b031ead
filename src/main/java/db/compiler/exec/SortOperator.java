package db.compiler.exec;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;

import db.compiler.catalog.ColumnSchema;
import db.compiler.catalog.DataType;
import db.compiler.catalog.Values;
import db.compiler.query.SortDirection;

/**
 * Blocking stable sort. The key is read from each row's origin (the source-table row),
 * so sorting works on columns that a projection has already dropped.
 * NUMBER keys compare numerically, STRING keys by code point; missing keys go last
 * in both directions.
 */
public class SortOperator implements Operator {
    private final Operator child;
    private final int keyIndex;
    private final ColumnSchema keyColumn;
    private final SortDirection direction;

    private List<Row> sorted;
    private Iterator<Row> iter;

    public SortOperator(Operator child, int keyIndex, ColumnSchema keyColumn, SortDirection direction) {
        this.child = child;
        this.keyIndex = keyIndex;
        this.keyColumn = keyColumn;
        this.direction = direction;
    }

    /** Resolves the key column against the source-table schema. */
    public static SortOperator forSourceColumn(Operator child, List<ColumnSchema> sourceSchema, String columnName, SortDirection direction) {
        for (int i = 0; i < sourceSchema.size(); i++) {
            if (sourceSchema.get(i).name().equals(columnName)) {
                return new SortOperator(child, i, sourceSchema.get(i), direction);
            }
        }
        throw new UnknownColumnException(columnName);
    }

    @Override
    public void open() {
        child.open();
        sorted = new ArrayList<>();
        Row r;
        while ((r = child.next()) != null) sorted.add(r);
        // List.sort is a stable merge sort; ties keep their input order for both directions
        sorted.sort(Comparator.comparing((Row row) -> row.origin().values().get(keyIndex), this::compareKeys));
        iter = sorted.iterator();
    }

    private int compareKeys(Object a, Object b) {
        if (a == null || b == null) {
            if (a == b) return 0;
            return a == null ? 1 : -1;
        }
        int cmp;
        if (keyColumn.type() == DataType.NUMBER) {
            Double da = Values.toNumber(a);
            Double db = Values.toNumber(b);
            if (da == null) throw new TypeMismatchException(keyColumn.name(), DataType.NUMBER, a);
            if (db == null) throw new TypeMismatchException(keyColumn.name(), DataType.NUMBER, b);
            cmp = Double.compare(da, db);
        } else {
            cmp = Values.compareCodePoints(Values.text(a), Values.text(b));
        }
        return direction == SortDirection.DESC ? -cmp : cmp;
    }

    @Override
    public Row next() {
        if (iter == null || !iter.hasNext()) return null;
        return iter.next();
    }

    @Override
    public void close() {
        child.close();
        sorted = null;
        iter = null;
    }

    @Override
    public List<ColumnSchema> schema() { return child.schema(); }
}
