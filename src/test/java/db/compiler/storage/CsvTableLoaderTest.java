package db.compiler.storage;

import static org.junit.jupiter.api.Assertions.*;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import db.compiler.catalog.DataType;
import db.compiler.catalog.Table;

public class CsvTableLoaderTest {

    @TempDir
    Path dir;

    private Table read(String text) throws IOException {
        return new CsvTableLoader().read("t", new BufferedReader(new StringReader(text)));
    }

    @Test
    void loadsFileAndInfersColumnTypes() throws IOException {
        Path file = dir.resolve("students.csv");
        Files.writeString(file, "name,age,grade,city\nAnn,22,A,Chicago\nBo,19,B,New York\nCy,22,A,Chicago\n");

        Table t = new CsvTableLoader().load(file);

        assertEquals("students", t.name());
        assertEquals(List.of("name", "age", "grade", "city"), t.schema().columnNames());
        assertEquals(DataType.STRING, t.columns().get(0).type());
        assertEquals(DataType.NUMBER, t.columns().get(1).type());
        assertEquals(3, t.rowCount());
        assertEquals(Arrays.asList("Bo", 19.0, "B", "New York"), t.records().get(1).getValues());
    }

    @Test
    void oneNonNumericCellMakesColumnString() throws IOException {
        Table t = read("id,code\n1,42\n2,x7\n");
        assertEquals(DataType.NUMBER, t.columns().get(0).type());
        assertEquals(DataType.STRING, t.columns().get(1).type());
        assertEquals("42", t.records().get(0).get(1));
    }

    @Test
    void emptyCellsAreNullAndDoNotAffectType() throws IOException {
        Table t = read("name,score\nAnn,\nBo,3.5\n");
        assertEquals(DataType.NUMBER, t.columns().get(1).type());
        assertNull(t.records().get(0).get(1));
        assertEquals(3.5, t.records().get(1).get(1));
    }

    @Test
    void shortRowsArePadded() throws IOException {
        Table t = read("a,b,c\n1,2\n");
        assertEquals(Arrays.asList(1.0, 2.0, null), t.records().get(0).getValues());
    }

    @Test
    void longRowIsRejected() {
        IOException e = assertThrows(IOException.class, () -> read("a,b\n1,2,3\n"));
        assertTrue(e.getMessage().contains("Line 2"), e.getMessage());
    }

    @Test
    void quotedFieldsMayHoldDelimiterAndQuotes() throws IOException {
        Table t = read("name,city\n\"Smith, Jo\",\"The \"\"Big\"\" Apple\"\n");
        assertEquals("Smith, Jo", t.records().get(0).get(0));
        assertEquals("The \"Big\" Apple", t.records().get(0).get(1));
    }

    @Test
    void unterminatedQuoteIsRejected() {
        assertThrows(IOException.class, () -> read("a\n\"open\n"));
    }

    @Test
    void blankLinesAreSkipped() throws IOException {
        Table t = read("\nname\n\nAnn\n\nBo\n");
        assertEquals(2, t.rowCount());
    }

    @Test
    void headerOnlyGivesEmptyStringColumns() throws IOException {
        Table t = read("a,b\n");
        assertEquals(0, t.rowCount());
        assertEquals(DataType.STRING, t.columns().get(0).type());
    }

    @Test
    void emptyInputHasNoHeader() {
        assertThrows(IOException.class, () -> read(""));
    }

    @Test
    void emptyColumnNameIsRejected() {
        assertThrows(IOException.class, () -> read("a,,c\n1,2,3\n"));
    }

    @Test
    void honorsCustomDelimiter() throws IOException {
        Table t = new CsvTableLoader(';').read("t", new BufferedReader(new StringReader("a;b\n1;x,y\n")));
        assertEquals("x,y", t.records().get(0).get(1));
    }

    @Test
    void numericWordsStayStrings() throws IOException {
        Table t = read("v\nNaN\nInfinity\n");
        assertEquals(DataType.STRING, t.columns().get(0).type());
        assertEquals("NaN", t.records().get(0).get(0));
    }

    @Test
    void suffixedAndHexNumbersStayStrings() throws IOException {
        Table t = read("code\n12f\n5d\n0x1A\n");
        assertEquals(DataType.STRING, t.columns().get(0).type());
        assertEquals("12f", t.records().get(0).get(0));
    }

    @Test
    void negativeZeroLoadsAsZero() throws IOException {
        Table t = read("x\n-0\n0\n");
        assertEquals(DataType.NUMBER, t.columns().get(0).type());
        assertEquals(0.0, t.records().get(0).get(0));
        assertEquals(t.records().get(1).get(0), t.records().get(0).get(0));
    }

    @Test
    void tableNameComesFromFileName() {
        assertEquals("students", CsvTableLoader.tableNameFor(Path.of("data", "students.csv")));
        assertEquals("mydata2024", CsvTableLoader.tableNameFor(Path.of("my-data 2024.csv")));
        assertThrows(IllegalArgumentException.class, () -> CsvTableLoader.tableNameFor(Path.of("---.csv")));
    }

    @Test
    void rejectsQuoteAsDelimiter() {
        assertThrows(IllegalArgumentException.class, () -> new CsvTableLoader('"'));
    }
}
