package db.compiler.exec;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import db.compiler.catalog.ColumnSchema;
import db.compiler.catalog.Table;
import db.compiler.catalog.TableSchema;
import db.compiler.plan.Operation;
import db.compiler.plan.QueryPlan;
import db.compiler.storage.Record;

/**
 * Executes a plan against a table: builds the operator pipeline
 * (scan, filter, projection, sort, limit) and drains it into a new Table.
 * The source table is never modified.
 */
public class QueryExecutor {
    private final PredicateCompiler predicateCompiler = new PredicateCompiler();

    public Table execute(QueryPlan plan, Table table) {
        if (plan == null) throw new IllegalArgumentException("plan must not be null");
        if (table == null) throw new IllegalArgumentException("table must not be null");
        Operator root = build(plan, table);
        List<Record> out = new ArrayList<>();
        for (Row r : stream(root)) out.add(r.record());
        return new Table(new TableSchema(table.name(), root.schema()), out);
    }

    /**
     * Builds the physical pipeline. Column references are resolved here, in plan order,
     * so an unknown column fails before any row is read.
     */
    public Operator build(QueryPlan plan, Table table) {
        List<ColumnSchema> sourceSchema = table.columns();
        Operator root = new TableScanOperator(table);
        for (Operation op : plan.operations()) {
            if (op instanceof Operation.Filter f) {
                root = new FilterOperator(root, predicateCompiler.compile(f.predicate(), sourceSchema));
            } else if (op instanceof Operation.Project p) {
                root = p.allColumns() ? ProjectionOperator.allColumns(root) : ProjectionOperator.forColumnNames(root, p.columns());
            } else if (op instanceof Operation.Distinct) {
                root = new DistinctOperator(root);
            } else if (op instanceof Operation.Sort s) {
                root = SortOperator.forSourceColumn(root, sourceSchema, s.sourceColumn(), s.direction());
            } else if (op instanceof Operation.Limit l) {
                root = new LimitOperator(root, l.count(), l.offset());
            } else {
                throw new IllegalStateException("Unhandled operation: " + op);
            }
        }
        return root;
    }

    /**
     * Streaming interface: returns an Iterable that opens the operator on first iteration
     * and closes it when exhausted or when a row fails to evaluate.
     */
    public Iterable<Row> stream(Operator op) {
        return () -> new Iterator<Row>() {
            private boolean opened = false;
            private Row next = null;
            private boolean finished = false;

            private void ensureOpen() {
                if (!opened) {
                    opened = true;
                    try {
                        op.open();
                    } catch (RuntimeException e) {
                        finished = true;
                        op.close();
                        throw e;
                    }
                    advance();
                }
            }

            private void advance() {
                if (finished) return;
                try {
                    next = op.next();
                } catch (RuntimeException e) {
                    finished = true;
                    op.close();
                    throw e;
                }
                if (next == null) {
                    finished = true;
                    op.close();
                }
            }

            @Override
            public boolean hasNext() {
                ensureOpen();
                return !finished;
            }

            @Override
            public Row next() {
                if (!hasNext()) throw new NoSuchElementException();
                Row current = next;
                advance();
                return current;
            }
        };
    }
}
