package db.compiler.query;

/** IR that cannot be turned into an executable plan. */
public class PlanException extends QueryException {

    public PlanException(String message) {
        super(Stage.PLAN, message, NO_POSITION);
    }
}
