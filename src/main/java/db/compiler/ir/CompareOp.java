package db.compiler.ir;

import db.compiler.query.TokenType;

/**
 * Canonical comparison operators. Every spelling accepted by the lexer maps to one
 * of these six ({@code <>} and {@code !=} both become {@link #NE}).
 */
public enum CompareOp {
    EQ("="),
    NE("!="),
    LT("<"),
    GT(">"),
    LE("<="),
    GE(">=");

    private final String symbol;

    CompareOp(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() { return symbol; }

    public static CompareOp fromToken(TokenType type) {
        return switch (type) {
            case EQ -> EQ;
            case NE -> NE;
            case LT -> LT;
            case GT -> GT;
            case LE -> LE;
            case GE -> GE;
            default -> throw new IllegalArgumentException("Not a comparison token: " + type);
        };
    }

    /** Applies this operator to the sign of a three-way comparison result. */
    public boolean test(int cmp) {
        return switch (this) {
            case EQ -> cmp == 0;
            case NE -> cmp != 0;
            case LT -> cmp < 0;
            case GT -> cmp > 0;
            case LE -> cmp <= 0;
            case GE -> cmp >= 0;
        };
    }
}
