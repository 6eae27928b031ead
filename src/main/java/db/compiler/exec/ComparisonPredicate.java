package db.compiler.exec;

import java.util.List;

import db.compiler.catalog.ColumnSchema;
import db.compiler.catalog.DataType;
import db.compiler.catalog.Values;
import db.compiler.ir.CompareOp;
import db.compiler.ir.IrValue;

/**
 * Compares one column against a typed literal.
 * Number literals compare numerically (cell coerced to a number, TypeMismatch if it cannot be);
 * string literals compare the cell's text by code point. A missing cell only satisfies {@code !=}.
 */
public class ComparisonPredicate implements Predicate {
    private final int columnIndex;
    private final String columnName;
    private final CompareOp op;
    private final IrValue literal;

    public ComparisonPredicate(int columnIndex, String columnName, CompareOp op, IrValue literal) {
        this.columnIndex = columnIndex;
        this.columnName = columnName;
        this.op = op;
        this.literal = literal;
    }

    public static ComparisonPredicate forColumnName(List<ColumnSchema> schema, String columnName, CompareOp op, IrValue literal) {
        return new ComparisonPredicate(PredicateCompiler.columnIndex(schema, columnName), columnName, op, literal);
    }

    @Override
    public boolean test(Row row) {
        Object v = row.values().get(columnIndex);
        if (v == null) return op == CompareOp.NE;
        return op.test(compareCell(columnName, v, literal));
    }

    /** Three-way comparison of a non-null cell with a literal, using the literal's type. */
    static int compareCell(String columnName, Object v, IrValue literal) {
        if (literal instanceof IrValue.NumberValue number) {
            Double d = Values.toNumber(v);
            if (d == null) throw new TypeMismatchException(columnName, DataType.NUMBER, v);
            double x = d;
            double y = number.value();
            // plain operators so that -0.0 and 0.0 compare equal
            return x < y ? -1 : (x > y ? 1 : 0);
        }
        return Values.compareCodePoints(Values.text(v), ((IrValue.StringValue) literal).value());
    }

    // For debugging
    @Override
    public String toString() {
        return columnName + " " + op.symbol() + " " + literalText(literal);
    }

    static String literalText(IrValue literal) {
        if (literal instanceof IrValue.StringValue s) return "'" + s.value() + "'";
        return Values.numberText(((IrValue.NumberValue) literal).value());
    }
}
