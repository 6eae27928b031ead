package db.compiler.query;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.StringJoiner;

/**
 * First token that does not match the production being parsed.
 */
public class SyntaxException extends QueryException {
    private final Set<TokenType> expected;
    private final Token found;

    public SyntaxException(Set<TokenType> expected, Token found) {
        super(Stage.PARSE, buildMessage(expected, found), found.position());
        this.expected = Collections.unmodifiableSet(sorted(expected));
        this.found = found;
    }

    public Set<TokenType> expected() { return expected; }
    public Token found() { return found; }

    private static EnumSet<TokenType> sorted(Set<TokenType> kinds) {
        EnumSet<TokenType> set = EnumSet.noneOf(TokenType.class);
        set.addAll(kinds);
        return set;
    }

    private static String buildMessage(Set<TokenType> expected, Token found) {
        StringJoiner joiner = new StringJoiner(", ");
        for (TokenType t : sorted(expected)) joiner.add(t.display());
        String what = expected.size() == 1 ? joiner.toString() : "one of [" + joiner + "]";
        return "Syntax error at position " + found.position() + ": expected " + what + " but found " + found;
    }
}
