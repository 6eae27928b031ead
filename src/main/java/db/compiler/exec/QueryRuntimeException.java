package db.compiler.exec;

import db.compiler.query.QueryException;
import db.compiler.query.Stage;

/** Failure while executing a plan against a concrete table. */
public abstract class QueryRuntimeException extends QueryException {

    protected QueryRuntimeException(String message) {
        super(Stage.EXEC, message, NO_POSITION);
    }
}
