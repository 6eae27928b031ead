package db.compiler.exec;

import java.util.List;

import db.compiler.catalog.ColumnSchema;
import db.compiler.storage.Record;

/**
 * Row is an execution pipeline unit (values + schema + origin).
 * origin is the source-table row this row was derived from; scans produce rows that are
 * their own origin, and projection keeps the origin so later operators can still read
 * columns that were projected away.
 */
public class Row {
    private final Record record;
    private final List<ColumnSchema> schema;
    private final Row origin;

    public static Row source(Record record, List<ColumnSchema> schema) { return new Row(record, schema, null); }
    public static Row derived(Record record, List<ColumnSchema> schema, Row origin) { return new Row(record, schema, origin); }

    private Row(Record record, List<ColumnSchema> schema, Row origin) {
        this.record = record;
        this.schema = schema;
        this.origin = origin;
    }

    public Record record() { return record; }
    public List<Object> values() { return record.getValues(); }
    public List<ColumnSchema> schema() { return schema; }
    public Row origin() { return origin == null ? this : origin; }

    @Override
    public String toString() {
        return "Row" + values() + " schemaCols=" + schema.size();
    }
}
