package db.compiler.storage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered cell values of one row, aligned with a table schema.
 * Cells are Double (NUMBER), String (STRING) or null when missing.
 */
public class Record {
    private final List<Object> values;

    public Record(List<Object> values) {
        // List.copyOf rejects null elements, and missing cells are null
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public List<Object> getValues() {
        return values;
    }

    public Object get(int index) {
        return values.get(index);
    }

    public int size() {
        return values.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Record other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
