package db.compiler.cli;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import db.compiler.catalog.ColumnSchema;
import db.compiler.catalog.Table;
import db.compiler.ir.IrExpr;
import db.compiler.ir.IrQuery;
import db.compiler.ir.IrValue;
import db.compiler.plan.Operation;
import db.compiler.plan.QueryPlan;
import db.compiler.query.CompiledQuery;
import db.compiler.query.QueryResult;
import db.compiler.query.Token;

/**
 * JSON views of results and compilation stages. Builds LinkedHashMap trees so keys
 * keep a fixed order, then prints them with Gson.
 */
public final class JsonRenderer {
    // Disable HTML escaping so operators like < and != stay readable
    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().setPrettyPrinting().serializeNulls().create();

    private JsonRenderer() {}

    public static String render(QueryResult result) {
        Map<String, Object> root = new LinkedHashMap<>();
        if (result instanceof QueryResult.Success s) {
            root.put("status", "success");
            root.put("columns", columns(s.table()));
            root.put("rows", rows(s.table()));
            root.put("row_count", s.table().rowCount());
        } else {
            QueryResult.Failure f = (QueryResult.Failure) result;
            root.put("status", "failure");
            root.put("stage", f.stage().name());
            root.put("message", f.message());
            if (f.hasPosition()) root.put("position", f.position());
        }
        return GSON.toJson(root);
    }

    /** Every stage of one compilation: tokens, IR and plan. */
    public static String render(CompiledQuery compiled) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("query", compiled.text());
        root.put("tokens", tokens(compiled.tokens()));
        root.put("ir", ir(compiled.ir()));
        root.put("plan", plan(compiled.plan()));
        return GSON.toJson(root);
    }

    static List<Object> tokens(List<Token> tokens) {
        List<Object> out = new ArrayList<>(tokens.size());
        for (Token t : tokens) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("type", t.type().name());
            entry.put("text", t.text());
            entry.put("position", t.position());
            out.add(entry);
        }
        return out;
    }

    static Map<String, Object> ir(IrQuery ir) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("op", ir.op());
        root.put("columns", ir.allColumns() ? "*" : ir.columns());
        root.put("table", ir.table());
        root.put("distinct", ir.distinct());
        if (ir.filter() != null) root.put("filter", expr(ir.filter()));
        if (ir.ordering() != null) {
            Map<String, Object> order = new LinkedHashMap<>();
            order.put("column", ir.ordering().column());
            order.put("ascending", ir.ordering().ascending());
            root.put("order_by", order);
        }
        if (ir.limit() != null) {
            Map<String, Object> limit = new LinkedHashMap<>();
            limit.put("count", number(ir.limit().count()));
            limit.put("offset", number(ir.limit().offset()));
            root.put("limit", limit);
        }
        return root;
    }

    static List<Object> plan(QueryPlan plan) {
        List<Object> out = new ArrayList<>();
        for (Operation op : plan.operations()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            if (op instanceof Operation.Filter f) {
                entry.put("op", "filter");
                entry.put("predicate", expr(f.predicate()));
            } else if (op instanceof Operation.Project p) {
                entry.put("op", "project");
                entry.put("columns", p.allColumns() ? "*" : p.columns());
            } else if (op instanceof Operation.Distinct) {
                entry.put("op", "distinct");
            } else if (op instanceof Operation.Sort s) {
                entry.put("op", "sort");
                entry.put("column", s.sourceColumn());
                entry.put("direction", s.direction().name());
            } else if (op instanceof Operation.Limit l) {
                entry.put("op", "limit");
                entry.put("count", l.count());
                entry.put("offset", l.offset());
            }
            out.add(entry);
        }
        return out;
    }

    private static Map<String, Object> expr(IrExpr expr) {
        Map<String, Object> node = new LinkedHashMap<>();
        if (expr instanceof IrExpr.And and) {
            node.put("and", List.of(expr(and.left()), expr(and.right())));
        } else if (expr instanceof IrExpr.Or or) {
            node.put("or", List.of(expr(or.left()), expr(or.right())));
        } else if (expr instanceof IrExpr.IsNull isNull) {
            node.put("column", isNull.column());
            node.put("op", isNull.negated() ? "IS NOT NULL" : "IS NULL");
        } else if (expr instanceof IrExpr.Between between) {
            node.put("column", between.column());
            node.put("op", between.negated() ? "NOT BETWEEN" : "BETWEEN");
            node.put("low", value(between.low()));
            node.put("high", value(between.high()));
        } else if (expr instanceof IrExpr.Like like) {
            node.put("column", like.column());
            node.put("op", like.negated() ? "NOT LIKE" : "LIKE");
            node.put("pattern", like.pattern());
        } else {
            IrExpr.Compare cmp = (IrExpr.Compare) expr;
            node.put("column", cmp.column());
            node.put("op", cmp.op().symbol());
            node.put("value", value(cmp.value()));
        }
        return node;
    }

    private static Object value(IrValue value) {
        if (value instanceof IrValue.StringValue sv) return sv.value();
        return number(((IrValue.NumberValue) value).value());
    }

    private static List<Object> columns(Table table) {
        List<Object> out = new ArrayList<>();
        for (ColumnSchema c : table.columns()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", c.name());
            entry.put("type", c.type().name());
            out.add(entry);
        }
        return out;
    }

    // Rows as arrays so duplicate projected columns survive.
    private static List<Object> rows(Table table) {
        List<Object> out = new ArrayList<>(table.rowCount());
        for (var record : table.records()) {
            List<Object> cells = new ArrayList<>(record.size());
            for (Object v : record.getValues()) {
                cells.add(v instanceof Double d ? number(d) : v);
            }
            out.add(cells);
        }
        return out;
    }

    // Whole numbers print as 22, not 22.0
    private static Object number(double d) {
        if (d == Math.rint(d) && Math.abs(d) < 1e15) return (long) d;
        return d;
    }
}
