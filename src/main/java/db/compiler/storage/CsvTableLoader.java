package db.compiler.storage;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import db.compiler.catalog.ColumnSchema;
import db.compiler.catalog.DataType;
import db.compiler.catalog.Table;
import db.compiler.catalog.TableSchema;
import db.compiler.catalog.Values;

/**
 * Loads a delimited text file into an in-memory Table.
 * Header row gives column names; a column is NUMBER when every non-empty cell parses
 * as a decimal number, otherwise STRING. Empty cells become null.
 */
public class CsvTableLoader {
    public static final char DEFAULT_DELIMITER = ',';

    private final char delimiter;

    public CsvTableLoader() {
        this(DEFAULT_DELIMITER);
    }

    public CsvTableLoader(char delimiter) {
        if (delimiter == '"' || delimiter == '\n' || delimiter == '\r') {
            throw new IllegalArgumentException("Unsupported delimiter: " + delimiter);
        }
        this.delimiter = delimiter;
    }

    public Table load(Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path must not be null");
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(tableNameFor(path), reader);
        }
    }

    /** Parses delimited text from a reader; the first non-blank line is the header. */
    public Table read(String tableName, BufferedReader reader) throws IOException {
        List<String> header = null;
        List<List<String>> rawRows = new ArrayList<>();
        String line;
        int lineNo = 0;
        while ((line = reader.readLine()) != null) {
            lineNo++;
            if (line.isBlank()) continue;
            List<String> fields = splitLine(line, lineNo);
            if (header == null) {
                header = fields;
                validateHeader(header, lineNo);
                continue;
            }
            if (fields.size() > header.size()) {
                throw new IOException("Line " + lineNo + " has " + fields.size() + " fields but header has " + header.size());
            }
            while (fields.size() < header.size()) fields.add("");
            rawRows.add(fields);
        }
        if (header == null) throw new IOException("No header row in table '" + tableName + "'");

        List<ColumnSchema> columns = new ArrayList<>(header.size());
        for (int c = 0; c < header.size(); c++) {
            columns.add(new ColumnSchema(header.get(c), inferType(rawRows, c)));
        }
        List<Record> records = new ArrayList<>(rawRows.size());
        for (List<String> raw : rawRows) {
            List<Object> values = new ArrayList<>(raw.size());
            for (int c = 0; c < raw.size(); c++) values.add(convert(raw.get(c), columns.get(c).type()));
            records.add(new Record(values));
        }
        return new Table(new TableSchema(tableName, columns), records);
    }

    /** File name without extension, reduced to identifier characters. */
    public static String tableNameFor(Path path) {
        String file = path.getFileName().toString();
        int dot = file.lastIndexOf('.');
        if (dot > 0) file = file.substring(0, dot);
        StringBuilder sb = new StringBuilder(file.length());
        for (int i = 0; i < file.length(); i++) {
            char ch = file.charAt(i);
            if (Character.isLetterOrDigit(ch) || ch == '_') sb.append(ch);
        }
        if (sb.length() == 0) throw new IllegalArgumentException("Cannot derive table name from " + path);
        return sb.toString();
    }

    private void validateHeader(List<String> header, int lineNo) throws IOException {
        for (int i = 0; i < header.size(); i++) {
            if (header.get(i).isEmpty()) throw new IOException("Empty column name at position " + (i + 1) + " on line " + lineNo);
        }
    }

    private DataType inferType(List<List<String>> rows, int column) {
        boolean sawValue = false;
        for (List<String> row : rows) {
            String cell = row.get(column);
            if (cell.isEmpty()) continue;
            sawValue = true;
            if (!Values.isNumeric(cell)) return DataType.STRING;
        }
        return sawValue ? DataType.NUMBER : DataType.STRING;
    }

    private Object convert(String cell, DataType type) {
        if (cell.isEmpty()) return null;
        return type == DataType.NUMBER ? Values.toNumber(cell) : cell;
    }

    // Split one line honoring double-quoted fields; "" inside quotes is a literal quote.
    private List<String> splitLine(String line, int lineNo) throws IOException {
        List<String> out = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuote = false;
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (inQuote) {
                if (ch == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        current.append('"');
                        i++;
                    } else {
                        inQuote = false;
                    }
                } else {
                    current.append(ch);
                }
            } else if (ch == '"') {
                inQuote = true;
            } else if (ch == delimiter) {
                out.add(current.toString().trim());
                current.setLength(0);
            } else {
                current.append(ch);
            }
        }
        if (inQuote) throw new IOException("Unterminated quoted field on line " + lineNo);
        out.add(current.toString().trim());
        return out;
    }
}
