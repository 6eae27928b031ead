package db.compiler.catalog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Registry of loaded tables keyed by name. Lives in the front-end process;
 * the compilation core never consults it.
 */
public class Catalog {
    private final Map<String, Table> tables = new LinkedHashMap<>();

    /** Registers a table, replacing any table of the same name. Returns true if it was new. */
    public boolean registerTable(Table table) {
        if (table == null) throw new IllegalArgumentException("table must not be null");
        return tables.put(table.name(), table) == null;
    }

    public Table getTable(String name) {
        return tables.get(name);
    }

    public Map<String, Table> allTables() {
        return Collections.unmodifiableMap(tables);
    }
}
