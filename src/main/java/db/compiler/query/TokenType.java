package db.compiler.query;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Token kinds produced by {@link SqlLexer}. Keywords are matched case-insensitively
 * and always map to the same kind.
 */
public enum TokenType {
    // Keywords
    SELECT(true, "SELECT"),
    FROM(true, "FROM"),
    WHERE(true, "WHERE"),
    ORDER(true, "ORDER"),
    BY(true, "BY"),
    AND(true, "AND"),
    OR(true, "OR"),
    ASC(true, "ASC"),
    DESC(true, "DESC"),
    LIMIT(true, "LIMIT"),
    OFFSET(true, "OFFSET"),
    DISTINCT(true, "DISTINCT"),
    IS(true, "IS"),
    NOT(true, "NOT"),
    NULL(true, "NULL"),
    BETWEEN(true, "BETWEEN"),
    LIKE(true, "LIKE"),

    // Literals and names
    IDENTIFIER(false, "identifier"),
    STRING_LITERAL(false, "string literal"),
    NUMBER_LITERAL(false, "number literal"),

    // Operators and punctuation
    EQ(false, "="),
    NE(false, "!="),
    LT(false, "<"),
    GT(false, ">"),
    LE(false, "<="),
    GE(false, ">="),
    STAR(false, "*"),
    COMMA(false, ","),
    SEMICOLON(false, ";"),

    EOF(false, "end of input");

    private static final Map<String, TokenType> KEYWORDS = new HashMap<>();
    static {
        for (TokenType t : values()) {
            if (t.keyword) KEYWORDS.put(t.display, t);
        }
    }

    private final boolean keyword;
    private final String display;

    TokenType(boolean keyword, String display) {
        this.keyword = keyword;
        this.display = display;
    }

    public boolean isKeyword() { return keyword; }

    /** Human readable form used in diagnostics. */
    public String display() { return display; }

    public boolean isComparison() {
        return this == EQ || this == NE || this == LT || this == GT || this == LE || this == GE;
    }

    /** Keyword kind for a word in any letter case, or null if the word is not reserved. */
    public static TokenType keyword(String word) {
        return KEYWORDS.get(word.toUpperCase(Locale.ROOT));
    }
}
