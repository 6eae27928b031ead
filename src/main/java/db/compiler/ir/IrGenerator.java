package db.compiler.ir;

import java.util.ArrayList;
import java.util.List;

import db.compiler.query.BoolExpr;
import db.compiler.query.Identifier;
import db.compiler.query.LimitClause;
import db.compiler.query.Literal;
import db.compiler.query.SelectList;
import db.compiler.query.SelectStatement;

/**
 * Lowers an AST into IR: canonical comparison operators and typed literals.
 * Column names are not checked here; that happens against a concrete table at execution.
 */
public class IrGenerator {

    public IrQuery lower(SelectStatement ast) {
        if (ast == null) throw new IllegalArgumentException("ast must not be null");
        boolean all = ast.columns() instanceof SelectList.All;
        List<String> columns = new ArrayList<>();
        if (ast.columns() instanceof SelectList.Columns named) {
            for (Identifier id : named.columns()) columns.add(id.name());
        }
        IrExpr filter = ast.where() == null ? null : lowerExpr(ast.where());
        IrOrdering ordering = ast.orderBy() == null ? null
                : new IrOrdering(ast.orderBy().column().name(), ast.orderBy().direction());
        IrLimit limit = ast.limit() == null ? null : lowerLimit(ast.limit());
        return new IrQuery(IrQuery.SELECT, all, columns, ast.table().name(), filter, ordering, limit,
                ast.distinct());
    }

    private IrExpr lowerExpr(BoolExpr expr) {
        if (expr instanceof BoolExpr.And and) {
            return new IrExpr.And(lowerExpr(and.left()), lowerExpr(and.right()));
        }
        if (expr instanceof BoolExpr.Or or) {
            return new IrExpr.Or(lowerExpr(or.left()), lowerExpr(or.right()));
        }
        if (expr instanceof BoolExpr.Comparison cmp) {
            return new IrExpr.Compare(cmp.column().name(), CompareOp.fromToken(cmp.operator().type()), lowerLiteral(cmp.literal()));
        }
        if (expr instanceof BoolExpr.IsNull isNull) {
            return new IrExpr.IsNull(isNull.column().name(), isNull.negated());
        }
        if (expr instanceof BoolExpr.Between between) {
            return new IrExpr.Between(between.column().name(), lowerLiteral(between.low()),
                    lowerLiteral(between.high()), between.negated());
        }
        if (expr instanceof BoolExpr.Like like) {
            return new IrExpr.Like(like.column().name(), like.pattern().value(), like.negated());
        }
        throw new IllegalStateException("Unhandled predicate node: " + expr);
    }

    private IrValue lowerLiteral(Literal literal) {
        if (literal instanceof Literal.NumberLiteral number) {
            return new IrValue.NumberValue(Double.parseDouble(number.text()));
        }
        if (literal instanceof Literal.StringLiteral string) {
            return new IrValue.StringValue(string.value());
        }
        throw new IllegalStateException("Unhandled literal: " + literal);
    }

    private IrLimit lowerLimit(LimitClause limit) {
        double count = Double.parseDouble(limit.count().text());
        double offset = limit.offset() == null ? 0 : Double.parseDouble(limit.offset().text());
        return new IrLimit(count, offset);
    }
}
