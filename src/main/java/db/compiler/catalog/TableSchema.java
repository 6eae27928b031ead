package db.compiler.catalog;

import java.util.ArrayList;
import java.util.List;

// Immutable data carrier for a table schema. Column order is the source order.
public record TableSchema(String name, List<ColumnSchema> columns) {

    public TableSchema {
        columns = List.copyOf(columns);
    }

    /** Index of the first column with the given name, or -1. */
    public int indexOf(String columnName) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).name().equals(columnName)) return i;
        }
        return -1;
    }

    public List<String> columnNames() {
        List<String> names = new ArrayList<>(columns.size());
        for (ColumnSchema c : columns) names.add(c.name());
        return names;
    }
}
