package db.compiler.ir;

/** Filter tree in normalized form; same shape as the AST predicate. */
public sealed interface IrExpr permits IrExpr.And, IrExpr.Or, IrExpr.Compare, IrExpr.IsNull, IrExpr.Between, IrExpr.Like {

    record And(IrExpr left, IrExpr right) implements IrExpr {
    }

    record Or(IrExpr left, IrExpr right) implements IrExpr {
    }

    record Compare(String column, CompareOp op, IrValue value) implements IrExpr {
    }

    /** {@code IS NULL}, or {@code IS NOT NULL} when negated. */
    record IsNull(String column, boolean negated) implements IrExpr {
    }

    /** Inclusive range test. */
    record Between(String column, IrValue low, IrValue high, boolean negated) implements IrExpr {
    }

    /** SQL pattern with {@code %} and {@code _} wildcards. */
    record Like(String column, String pattern, boolean negated) implements IrExpr {
    }
}
