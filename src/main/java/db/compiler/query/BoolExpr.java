package db.compiler.query;

/**
 * WHERE predicate tree. AND/OR are binary and built as left-deep chains;
 * comparisons and the other column tests are the leaves.
 */
public sealed interface BoolExpr permits BoolExpr.And, BoolExpr.Or, BoolExpr.Comparison,
        BoolExpr.IsNull, BoolExpr.Between, BoolExpr.Like {

    record And(BoolExpr left, BoolExpr right) implements BoolExpr {
    }

    record Or(BoolExpr left, BoolExpr right) implements BoolExpr {
    }

    /** {@code column <operator> literal}; operator is the comparison token as written. */
    record Comparison(Identifier column, Token operator, Literal literal) implements BoolExpr {
        public Comparison {
            if (!operator.type().isComparison()) {
                throw new IllegalArgumentException("Not a comparison operator: " + operator);
            }
        }
    }

    /** {@code column IS [NOT] NULL} */
    record IsNull(Identifier column, boolean negated) implements BoolExpr {
    }

    /** {@code column [NOT] BETWEEN low AND high} */
    record Between(Identifier column, Literal low, Literal high, boolean negated) implements BoolExpr {
    }

    /** {@code column [NOT] LIKE 'pattern'} */
    record Like(Identifier column, Literal.StringLiteral pattern, boolean negated) implements BoolExpr {
    }
}
