package db.compiler.ir;

import db.compiler.query.SortDirection;

public record IrOrdering(String column, SortDirection direction) {

    public boolean ascending() { return direction == SortDirection.ASC; }
}
