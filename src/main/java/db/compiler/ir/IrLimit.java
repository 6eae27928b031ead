package db.compiler.ir;

/** Row window; offset is 0 when the query has none. Integrality is checked by the planner. */
public record IrLimit(double count, double offset) {
}
