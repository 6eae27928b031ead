package db.compiler.catalog;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import db.compiler.storage.Record;

/**
 * In-memory table: a schema plus an ordered sequence of records.
 * Immutable once built; the query pipeline only ever produces new tables.
 */
public final class Table {
    private final TableSchema schema;
    private final List<Record> records;

    public Table(TableSchema schema, List<Record> records) {
        if (schema == null) throw new IllegalArgumentException("schema must not be null");
        if (records == null) throw new IllegalArgumentException("records must not be null");
        int width = schema.columns().size();
        for (Record r : records) {
            if (r.size() != width) {
                throw new IllegalArgumentException("Record width " + r.size() + " != column count " + width + " in table '" + schema.name() + "'");
            }
        }
        this.schema = schema;
        this.records = List.copyOf(records);
    }

    public String name() { return schema.name(); }
    public TableSchema schema() { return schema; }
    public List<ColumnSchema> columns() { return schema.columns(); }
    public List<Record> records() { return records; }
    public int rowCount() { return records.size(); }

    /**
     * Row i as a column-name keyed map in column order. Duplicate column names
     * (possible after projection) keep the first occurrence.
     */
    public Map<String, Object> rowAsMap(int i) {
        Record r = records.get(i);
        Map<String, Object> out = new LinkedHashMap<>();
        List<ColumnSchema> cols = schema.columns();
        for (int c = 0; c < cols.size(); c++) out.putIfAbsent(cols.get(c).name(), r.get(c));
        return out;
    }

    public List<Map<String, Object>> rowsAsMaps() {
        List<Map<String, Object>> out = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) out.add(rowAsMap(i));
        return out;
    }

    @Override
    public String toString() {
        return "Table[" + schema.name() + ", columns=" + schema.columnNames() + ", rows=" + records.size() + "]";
    }
}
