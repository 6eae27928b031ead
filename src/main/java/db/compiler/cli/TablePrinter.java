package db.compiler.cli;

import java.io.PrintWriter;
import java.util.List;

import db.compiler.catalog.ColumnSchema;
import db.compiler.catalog.Table;
import db.compiler.catalog.Values;
import db.compiler.storage.Record;

/**
 * Simple ASCII table printer for query results.
 * Prints at most {@code maxRows} rows; the footer always reports the full row count.
 */
public final class TablePrinter {
    private TablePrinter() {}

    public static void print(Table table, PrintWriter out, int maxRows) {
        List<ColumnSchema> schema = table.columns();
        int colCount = schema.size();
        if (colCount == 0 || table.rowCount() == 0) {
            out.println("(0 row(s))");
            return;
        }
        List<Record> shown = table.records().subList(0, Math.min(maxRows, table.rowCount()));
        String[] headers = new String[colCount];
        for (int i = 0; i < colCount; i++) headers[i] = schema.get(i).name();
        int[] widths = new int[colCount];
        for (int i = 0; i < colCount; i++) widths[i] = headers[i].length();
        for (Record r : shown) {
            for (int i = 0; i < colCount; i++) {
                String s = Values.text(r.get(i));
                if (s.length() > widths[i]) widths[i] = s.length();
            }
        }
        String divLine = buildDivider(widths);
        out.println(divLine);
        out.println(buildLine(headers, widths));
        out.println(divLine);
        String[] cells = new String[colCount];
        for (Record r : shown) {
            for (int i = 0; i < colCount; i++) cells[i] = Values.text(r.get(i));
            out.println(buildLine(cells, widths));
        }
        out.println(divLine);
        if (shown.size() < table.rowCount()) {
            out.println("... " + (table.rowCount() - shown.size()) + " more row(s) not shown");
        }
        out.println("(" + table.rowCount() + " row(s))");
    }

    private static String buildDivider(int[] widths) {
        StringBuilder divider = new StringBuilder();
        divider.append('+');
        for (int w : widths) {
            for (int k = 0; k < w + 2; k++) divider.append('-');
            divider.append('+');
        }
        return divider.toString();
    }

    private static String buildLine(String[] cells, int[] widths) {
        StringBuilder sb = new StringBuilder();
        sb.append('|');
        for (int i = 0; i < cells.length; i++) {
            sb.append(' ').append(pad(cells[i], widths[i])).append(' ').append('|');
        }
        return sb.toString();
    }

    private static String pad(String s, int width) {
        if (s.length() >= width) return s;
        StringBuilder sb = new StringBuilder(width);
        sb.append(s);
        for (int i = s.length(); i < width; i++) sb.append(' ');
        return sb.toString();
    }
}
