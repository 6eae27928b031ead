package db.compiler.query;

import java.util.List;

/** Column list of a SELECT: either {@code *} or explicit names in written order. */
public sealed interface SelectList permits SelectList.All, SelectList.Columns {

    record All(int position) implements SelectList {
    }

    record Columns(List<Identifier> columns) implements SelectList {
        public Columns {
            if (columns.isEmpty()) throw new IllegalArgumentException("column list must not be empty");
            columns = List.copyOf(columns);
        }
    }
}
