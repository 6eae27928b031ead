package db.compiler.plan;

import java.util.List;

import db.compiler.catalog.Values;
import db.compiler.ir.IrExpr;
import db.compiler.ir.IrValue;

/**
 * Ordered operations for one query plus the table name the query was written against.
 */
public record QueryPlan(String table, List<Operation> operations) {

    public QueryPlan {
        operations = List.copyOf(operations);
    }

    /** One line per operation, e.g. {@code Filter (age > 20)}. */
    public String explain() {
        StringBuilder sb = new StringBuilder();
        sb.append("Scan ").append(table);
        for (Operation op : operations) {
            sb.append(System.lineSeparator()).append("  -> ");
            if (op instanceof Operation.Filter f) {
                sb.append("Filter ").append(render(f.predicate()));
            } else if (op instanceof Operation.Project p) {
                sb.append("Project ").append(p.allColumns() ? "*" : String.join(", ", p.columns()));
            } else if (op instanceof Operation.Distinct) {
                sb.append("Distinct");
            } else if (op instanceof Operation.Sort s) {
                sb.append("Sort ").append(s.sourceColumn()).append(' ').append(s.direction());
            } else if (op instanceof Operation.Limit l) {
                sb.append("Limit ").append(l.count());
                if (l.offset() > 0) sb.append(" offset ").append(l.offset());
            }
        }
        return sb.toString();
    }

    static String render(IrExpr expr) {
        if (expr instanceof IrExpr.And and) {
            return "(" + render(and.left()) + " AND " + render(and.right()) + ")";
        }
        if (expr instanceof IrExpr.Or or) {
            return "(" + render(or.left()) + " OR " + render(or.right()) + ")";
        }
        if (expr instanceof IrExpr.IsNull isNull) {
            return isNull.column() + (isNull.negated() ? " IS NOT NULL" : " IS NULL");
        }
        if (expr instanceof IrExpr.Between between) {
            return between.column() + (between.negated() ? " NOT BETWEEN " : " BETWEEN ")
                    + render(between.low()) + " AND " + render(between.high());
        }
        if (expr instanceof IrExpr.Like like) {
            return like.column() + (like.negated() ? " NOT LIKE '" : " LIKE '") + like.pattern() + "'";
        }
        IrExpr.Compare cmp = (IrExpr.Compare) expr;
        return cmp.column() + " " + cmp.op().symbol() + " " + render(cmp.value());
    }

    private static String render(IrValue value) {
        if (value instanceof IrValue.StringValue s) return "'" + s.value() + "'";
        return Values.numberText(((IrValue.NumberValue) value).value());
    }
}
