package db.compiler.exec;

import java.util.Iterator;
import java.util.List;

import db.compiler.catalog.ColumnSchema;
import db.compiler.catalog.Table;
import db.compiler.storage.Record;

/**
 * Physical operator that reads every record of an in-memory table in source order.
 * Rows it produces are their own origin.
 */
public class TableScanOperator implements Operator {
    private final Table table;
    private Iterator<Record> iter;
    private boolean opened;

    public TableScanOperator(Table table) {
        if (table == null) throw new IllegalArgumentException("table must not be null");
        this.table = table;
    }

    @Override
    public void open() {
        iter = table.records().iterator();
        opened = true;
    }

    @Override
    public Row next() {
        if (!opened || !iter.hasNext()) return null;
        return Row.source(iter.next(), table.columns());
    }

    @Override
    public void close() {
        iter = null;
        opened = false;
    }

    @Override
    public List<ColumnSchema> schema() { return table.columns(); }
}
