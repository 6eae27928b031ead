package db.compiler.plan;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import db.compiler.ir.CompareOp;
import db.compiler.ir.IrExpr;
import db.compiler.ir.IrGenerator;
import db.compiler.ir.IrLimit;
import db.compiler.ir.IrQuery;
import db.compiler.ir.IrValue;
import db.compiler.query.PlanException;
import db.compiler.query.QueryException;
import db.compiler.query.SortDirection;
import db.compiler.query.SqlLexer;
import db.compiler.query.SqlParser;
import db.compiler.query.Stage;

public class QueryPlannerTest {
    private final QueryPlanner planner = new QueryPlanner();

    private QueryPlan plan(String sql) {
        return planner.plan(new IrGenerator().lower(new SqlParser().parse(new SqlLexer().tokenize(sql))));
    }

    @Test
    void plainSelectOnlyProjects() {
        QueryPlan p = plan("SELECT * FROM students");
        assertEquals("students", p.table());
        assertEquals(List.of(Operation.Project.all()), p.operations());
    }

    @Test
    void operationsComeInFixedOrder() {
        QueryPlan p = plan("SELECT name, age FROM students WHERE age > 20 ORDER BY age DESC LIMIT 2 OFFSET 1");
        assertEquals(List.of(
            new Operation.Filter(new IrExpr.Compare("age", CompareOp.GT, new IrValue.NumberValue(20))),
            Operation.Project.of(List.of("name", "age")),
            new Operation.Sort("age", SortDirection.DESC),
            new Operation.Limit(2, 1)
        ), p.operations());
    }

    @Test
    void sortKeyNeedNotBeProjected() {
        QueryPlan p = plan("SELECT name FROM students ORDER BY age");
        assertEquals(new Operation.Sort("age", SortDirection.ASC), p.operations().get(1));
    }

    @Test
    void fractionalLimitIsAPlanError() {
        PlanException e = assertThrows(PlanException.class, () -> plan("SELECT * FROM t LIMIT 1.5"));
        assertEquals(Stage.PLAN, e.stage());
        assertEquals(QueryException.NO_POSITION, e.position());
        assertTrue(e.getMessage().contains("LIMIT"), e.getMessage());
    }

    @Test
    void hugeOffsetIsAPlanError() {
        assertThrows(PlanException.class, () -> plan("SELECT * FROM t LIMIT 1 OFFSET 99999999999"));
    }

    @Test
    void onlySelectCanBePlanned() {
        IrQuery ir = new IrQuery("delete", true, List.of(), "t", null, null, null);
        assertThrows(PlanException.class, () -> planner.plan(ir));
    }

    @Test
    void limitWithoutOffsetStartsAtZero() {
        IrQuery ir = new IrQuery(IrQuery.SELECT, true, List.of(), "t", null, null, new IrLimit(3, 0));
        assertEquals(new Operation.Limit(3, 0), planner.plan(ir).operations().get(1));
    }

    @Test
    void explainListsOneOperationPerLine() {
        String[] lines = plan("SELECT name FROM students WHERE grade = 'A' AND age >= 21 ORDER BY age DESC LIMIT 1")
            .explain().split("\\R");
        assertArrayEquals(new String[] {
            "Scan students",
            "  -> Filter (grade = 'A' AND age >= 21)",
            "  -> Project name",
            "  -> Sort age DESC",
            "  -> Limit 1"
        }, lines);
    }

    @Test
    void distinctComesAfterProjection() {
        QueryPlan p = plan("SELECT DISTINCT city FROM students WHERE age IS NOT NULL ORDER BY city LIMIT 1");
        assertEquals(List.of(
            new Operation.Filter(new IrExpr.IsNull("age", true)),
            Operation.Project.of(List.of("city")),
            new Operation.Distinct(),
            new Operation.Sort("city", SortDirection.ASC),
            new Operation.Limit(1, 0)
        ), p.operations());
        assertTrue(p.explain().contains("-> Distinct"), p.explain());
    }

    @Test
    void distinctOrderByMustBeProjected() {
        PlanException e = assertThrows(PlanException.class, () -> plan("SELECT DISTINCT city FROM students ORDER BY age"));
        assertEquals(Stage.PLAN, e.stage());
        assertTrue(e.getMessage().contains("age"), e.getMessage());
        assertEquals(3, plan("SELECT DISTINCT * FROM students ORDER BY age").operations().size());
    }

    @Test
    void oversizedNumberLiteralFailsPlanning() {
        String huge = "1" + "0".repeat(400);
        PlanException e = assertThrows(PlanException.class, () -> plan("SELECT * FROM t WHERE a > " + huge));
        assertTrue(e.getMessage().contains("out of range"), e.getMessage());
        assertThrows(PlanException.class, () -> plan("SELECT * FROM t WHERE a BETWEEN 1 AND " + huge));
        assertThrows(PlanException.class, () -> plan("SELECT * FROM t LIMIT " + huge));
    }

    @Test
    void explainRendersColumnTests() {
        QueryPlan p = plan("SELECT * FROM t WHERE a IS NULL OR b NOT BETWEEN 1 AND 2.5 AND c LIKE 'x_'");
        assertTrue(p.explain().contains("Filter (a IS NULL OR (b NOT BETWEEN 1 AND 2.5 AND c LIKE 'x_'))"), p.explain());
    }
}
