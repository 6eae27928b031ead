package db.compiler.exec;

import java.util.List;

import db.compiler.catalog.ColumnSchema;
import db.compiler.ir.IrExpr;

/**
 * Compiles an IR filter tree into a physical Predicate bound to column positions of a schema.
 * Unknown columns fail here, before any row is read, in left-to-right order of the filter.
 */
public class PredicateCompiler {

    public Predicate compile(IrExpr filter, List<ColumnSchema> schema) {
        if (filter == null) throw new IllegalArgumentException("filter must not be null");
        if (filter instanceof IrExpr.And and) {
            Predicate left = compile(and.left(), schema);
            return CompoundPredicate.and(left, compile(and.right(), schema));
        }
        if (filter instanceof IrExpr.Or or) {
            Predicate left = compile(or.left(), schema);
            return CompoundPredicate.or(left, compile(or.right(), schema));
        }
        if (filter instanceof IrExpr.Compare cmp) {
            return ComparisonPredicate.forColumnName(schema, cmp.column(), cmp.op(), cmp.value());
        }
        if (filter instanceof IrExpr.IsNull isNull) {
            return new IsNullPredicate(columnIndex(schema, isNull.column()), isNull.column(), isNull.negated());
        }
        if (filter instanceof IrExpr.Between between) {
            return new BetweenPredicate(columnIndex(schema, between.column()), between.column(),
                    between.low(), between.high(), between.negated());
        }
        if (filter instanceof IrExpr.Like like) {
            return new LikePredicate(columnIndex(schema, like.column()), like.column(), like.pattern(), like.negated());
        }
        throw new IllegalStateException("Unhandled filter node: " + filter);
    }

    /** Position of the first column with this name; UnknownColumnException if none. */
    static int columnIndex(List<ColumnSchema> schema, String columnName) {
        for (int i = 0; i < schema.size(); i++) {
            if (schema.get(i).name().equals(columnName)) return i;
        }
        throw new UnknownColumnException(columnName);
    }
}
