package db.compiler.query;

/** Pipeline stage that produced a failure. */
public enum Stage {
    LEX,
    PARSE,
    IR,
    PLAN,
    EXEC
}
