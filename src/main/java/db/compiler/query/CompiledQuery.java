package db.compiler.query;

import java.util.List;

import db.compiler.ir.IrQuery;
import db.compiler.plan.QueryPlan;

/** Output of every compilation stage for one query text. */
public record CompiledQuery(String text, List<Token> tokens, SelectStatement ast, IrQuery ir, QueryPlan plan) {

    public CompiledQuery {
        tokens = List.copyOf(tokens);
    }
}
