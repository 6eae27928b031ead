package db.compiler.exec;

import java.util.regex.Pattern;

import db.compiler.catalog.Values;

/**
 * {@code column [NOT] LIKE 'pattern'}: {@code %} matches any run of characters, {@code _} exactly
 * one. Matching is case-sensitive over the whole cell text; number cells match through their
 * canonical text. A missing cell satisfies neither form.
 */
public class LikePredicate implements Predicate {
    private final int columnIndex;
    private final String columnName;
    private final String pattern;
    private final boolean negated;
    private final Pattern regex;

    public LikePredicate(int columnIndex, String columnName, String pattern, boolean negated) {
        this.columnIndex = columnIndex;
        this.columnName = columnName;
        this.pattern = pattern;
        this.negated = negated;
        this.regex = toRegex(pattern);
    }

    static Pattern toRegex(String pattern) {
        StringBuilder sb = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (int i = 0; i < pattern.length(); i++) {
            char ch = pattern.charAt(i);
            if (ch == '%' || ch == '_') {
                if (literal.length() > 0) {
                    sb.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                sb.append(ch == '%' ? ".*" : ".");
            } else {
                literal.append(ch);
            }
        }
        if (literal.length() > 0) sb.append(Pattern.quote(literal.toString()));
        return Pattern.compile(sb.toString(), Pattern.DOTALL);
    }

    @Override
    public boolean test(Row row) {
        Object v = row.values().get(columnIndex);
        if (v == null) return false;
        return negated != regex.matcher(Values.text(v)).matches();
    }

    @Override
    public String toString() {
        return columnName + (negated ? " NOT LIKE '" : " LIKE '") + pattern + "'";
    }
}
