package db.compiler.query;

/** Unrecognized character or unterminated string literal. */
public class LexException extends QueryException {

    public LexException(String message, int position) {
        super(Stage.LEX, "Lex error at position " + position + ": " + message, position);
    }
}
