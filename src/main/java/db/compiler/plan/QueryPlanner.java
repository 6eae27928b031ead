package db.compiler.plan;

import java.util.ArrayList;
import java.util.List;

import db.compiler.catalog.Values;
import db.compiler.ir.IrExpr;
import db.compiler.ir.IrLimit;
import db.compiler.ir.IrQuery;
import db.compiler.ir.IrValue;
import db.compiler.query.PlanException;

/**
 * Turns IR into an ordered operation list:
 *  1. Filter, only when the query has a WHERE clause.
 *  2. Project, always; the all-columns form for SELECT *.
 *  3. Distinct, only with SELECT DISTINCT.
 *  4. Sort, only with ORDER BY; keyed on the pre-projection row.
 *  5. Limit, only with LIMIT.
 */
public class QueryPlanner {

    public QueryPlan plan(IrQuery ir) {
        if (ir == null) throw new IllegalArgumentException("ir must not be null");
        if (!IrQuery.SELECT.equals(ir.op())) {
            throw new PlanException("Unsupported operation: " + ir.op());
        }
        List<Operation> ops = new ArrayList<>(5);
        if (ir.filter() != null) {
            checkLiterals(ir.filter());
            ops.add(new Operation.Filter(ir.filter()));
        }
        ops.add(ir.allColumns() ? Operation.Project.all() : Operation.Project.of(ir.columns()));
        if (ir.distinct()) {
            // A dropped duplicate may differ from the kept row in an unprojected sort key
            if (ir.ordering() != null && !ir.allColumns() && !ir.columns().contains(ir.ordering().column())) {
                throw new PlanException("ORDER BY column '" + ir.ordering().column()
                        + "' must appear in the SELECT DISTINCT column list");
            }
            ops.add(new Operation.Distinct());
        }
        if (ir.ordering() != null) {
            ops.add(new Operation.Sort(ir.ordering().column(), ir.ordering().direction()));
        }
        if (ir.limit() != null) {
            ops.add(planLimit(ir.limit()));
        }
        return new QueryPlan(ir.table(), ops);
    }

    private void checkLiterals(IrExpr expr) {
        if (expr instanceof IrExpr.And and) {
            checkLiterals(and.left());
            checkLiterals(and.right());
        } else if (expr instanceof IrExpr.Or or) {
            checkLiterals(or.left());
            checkLiterals(or.right());
        } else if (expr instanceof IrExpr.Compare cmp) {
            checkLiteral(cmp.value());
        } else if (expr instanceof IrExpr.Between between) {
            checkLiteral(between.low());
            checkLiteral(between.high());
        }
    }

    private void checkLiteral(IrValue value) {
        if (value instanceof IrValue.NumberValue n && !Double.isFinite(n.value())) {
            throw new PlanException("Number literal is out of range: " + n.value());
        }
    }

    private Operation.Limit planLimit(IrLimit limit) {
        return new Operation.Limit(toRowCount("LIMIT", limit.count()), toRowCount("OFFSET", limit.offset()));
    }

    private int toRowCount(String clause, double value) {
        if (value != Math.rint(value)) {
            throw new PlanException(clause + " must be a whole number of rows, got " + value);
        }
        if (value < 0 || value > Integer.MAX_VALUE) {
            throw new PlanException(clause + " out of range: " + Values.numberText(value));
        }
        return (int) value;
    }
}
