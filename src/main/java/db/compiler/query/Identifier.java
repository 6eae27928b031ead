package db.compiler.query;

/** Column or table name as written, with its source offset. */
public record Identifier(String name, int position) {
}
