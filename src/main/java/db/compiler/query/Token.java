package db.compiler.query;

/**
 * Lexical token. {@code text} is the source spelling, except for string literals
 * where it is the content between the quotes. {@code position} is the 0-based
 * character offset of the token's first character.
 */
public record Token(TokenType type, String text, int position) {

    @Override
    public String toString() {
        return switch (type) {
            case EOF -> "end of input";
            case STRING_LITERAL -> "'" + text + "'";
            case IDENTIFIER, NUMBER_LITERAL -> type.display() + " '" + text + "'";
            default -> "'" + text + "'";
        };
    }
}
