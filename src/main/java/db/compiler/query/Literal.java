package db.compiler.query;

/**
 * Literal operand of a comparison, tagged by the token kind it came from.
 * Number literals keep their source text; conversion happens once, in IR generation.
 */
public sealed interface Literal permits Literal.StringLiteral, Literal.NumberLiteral {

    int position();

    record StringLiteral(String value, int position) implements Literal {
    }

    record NumberLiteral(String text, int position) implements Literal {
    }
}
