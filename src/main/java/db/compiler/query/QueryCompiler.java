package db.compiler.query;

import java.util.List;

import db.compiler.ir.IrGenerator;
import db.compiler.ir.IrQuery;
import db.compiler.plan.QueryPlan;
import db.compiler.plan.QueryPlanner;

/**
 * Runs the compile-time stages in order: text, tokens, AST, IR, plan.
 * The first failing stage throws and later stages are not run.
 */
public class QueryCompiler {
    private final SqlLexer lexer = new SqlLexer();
    private final SqlParser parser = new SqlParser();
    private final IrGenerator irGenerator = new IrGenerator();
    private final QueryPlanner planner = new QueryPlanner();

    public CompiledQuery compile(String text) {
        if (text == null) throw new IllegalArgumentException("query text must not be null");
        List<Token> tokens = lexer.tokenize(text);
        SelectStatement ast = parser.parse(tokens);
        IrQuery ir = irGenerator.lower(ast);
        QueryPlan plan = planner.plan(ir);
        return new CompiledQuery(text, tokens, ast, ir, plan);
    }
}
