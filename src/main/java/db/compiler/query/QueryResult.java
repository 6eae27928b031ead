package db.compiler.query;

import java.util.List;
import java.util.Map;

import db.compiler.catalog.ColumnSchema;
import db.compiler.catalog.Table;

/** Outcome of running one query: a result table, or the first failure. */
public sealed interface QueryResult permits QueryResult.Success, QueryResult.Failure {

    boolean isSuccess();

    record Success(Table table) implements QueryResult {
        @Override
        public boolean isSuccess() { return true; }

        public List<ColumnSchema> columns() { return table.columns(); }

        /**
         * Rows keyed by column name. A column selected twice yields one key, so use
         * {@link #table()} when the projection may repeat a name.
         */
        public List<Map<String, Object>> rows() { return table.rowsAsMaps(); }
    }

    /** position is {@link QueryException#NO_POSITION} when the failing stage has none. */
    record Failure(Stage stage, String message, int position) implements QueryResult {
        @Override
        public boolean isSuccess() { return false; }

        public boolean hasPosition() { return position != QueryException.NO_POSITION; }

        public static Failure of(QueryException e) {
            return new Failure(e.stage(), e.getMessage(), e.position());
        }
    }
}
