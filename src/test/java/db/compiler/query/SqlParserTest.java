package db.compiler.query;

import static org.junit.jupiter.api.Assertions.*;

import java.util.EnumSet;
import java.util.List;

import org.junit.jupiter.api.Test;

public class SqlParserTest {
    private final SqlLexer lexer = new SqlLexer();
    private final SqlParser parser = new SqlParser();

    private SelectStatement parse(String sql) {
        return parser.parse(lexer.tokenize(sql));
    }

    private SyntaxException fails(String sql) {
        return assertThrows(SyntaxException.class, () -> parse(sql));
    }

    private static String column(BoolExpr expr) {
        return ((BoolExpr.Comparison) expr).column().name();
    }

    @Test
    void parsesFullStatement() {
        SelectStatement s = parse("SELECT name, age FROM students WHERE age > 20 ORDER BY age DESC");

        SelectList.Columns cols = assertInstanceOf(SelectList.Columns.class, s.columns());
        assertEquals(List.of(new Identifier("name", 7), new Identifier("age", 13)), cols.columns());
        assertEquals(new Identifier("students", 22), s.table());

        BoolExpr.Comparison where = assertInstanceOf(BoolExpr.Comparison.class, s.where());
        assertEquals("age", where.column().name());
        assertEquals(TokenType.GT, where.operator().type());
        assertEquals(new Literal.NumberLiteral("20", 43), where.literal());

        assertEquals(new OrderBy(new Identifier("age", 55), SortDirection.DESC), s.orderBy());
        assertNull(s.limit());
    }

    @Test
    void starSelectsAllColumns() {
        SelectStatement s = parse("SELECT * FROM t");
        assertEquals(new SelectList.All(7), s.columns());
        assertNull(s.where());
        assertNull(s.orderBy());
    }

    @Test
    void orderDirectionDefaultsToAscending() {
        assertEquals(SortDirection.ASC, parse("SELECT * FROM t ORDER BY a").orderBy().direction());
        assertEquals(SortDirection.ASC, parse("SELECT * FROM t ORDER BY a asc").orderBy().direction());
    }

    @Test
    void andBindsTighterThanOr() {
        BoolExpr.Or or = assertInstanceOf(BoolExpr.Or.class, parse("SELECT * FROM t WHERE a = 1 OR b = 2 AND c = 3").where());
        assertEquals("a", column(or.left()));
        BoolExpr.And and = assertInstanceOf(BoolExpr.And.class, or.right());
        assertEquals("b", column(and.left()));
        assertEquals("c", column(and.right()));
    }

    @Test
    void chainsAreLeftAssociative() {
        BoolExpr.And outer = assertInstanceOf(BoolExpr.And.class, parse("SELECT * FROM t WHERE a = 1 AND b = 2 AND c = 3").where());
        BoolExpr.And inner = assertInstanceOf(BoolExpr.And.class, outer.left());
        assertEquals("a", column(inner.left()));
        assertEquals("b", column(inner.right()));
        assertEquals("c", column(outer.right()));

        BoolExpr.Or orOuter = assertInstanceOf(BoolExpr.Or.class, parse("SELECT * FROM t WHERE a = 1 OR b = 2 OR c = 3").where());
        assertInstanceOf(BoolExpr.Or.class, orOuter.left());
    }

    @Test
    void keepsLiteralKinds() {
        BoolExpr.Comparison c = (BoolExpr.Comparison) parse("SELECT * FROM t WHERE code = '42'").where();
        assertEquals(new Literal.StringLiteral("42", 29), c.literal());
    }

    @Test
    void parsesLimitAndOffset() {
        SelectStatement s = parse("SELECT * FROM t ORDER BY a LIMIT 5 OFFSET 10;");
        assertEquals("5", s.limit().count().text());
        assertEquals("10", s.limit().offset().text());
        assertNull(parse("SELECT * FROM t LIMIT 3").limit().offset());
    }

    @Test
    void parsingIsDeterministic() {
        String sql = "SELECT name FROM students WHERE city = 'Chicago' OR age >= 21 AND grade != 'B' ORDER BY name";
        assertEquals(parse(sql), parse(sql));
    }

    @Test
    void missingColumnListPointsAtFrom() {
        SyntaxException e = fails("SELECT FROM students");
        assertEquals(7, e.position());
        assertEquals(Stage.PARSE, e.stage());
        assertEquals(TokenType.FROM, e.found().type());
        assertEquals(EnumSet.of(TokenType.DISTINCT, TokenType.IDENTIFIER, TokenType.STAR), e.expected());
        assertTrue(e.getMessage().startsWith("Syntax error at position 7"), e.getMessage());
    }

    @Test
    void missingFromReportsCommaOrFrom() {
        SyntaxException e = fails("SELECT name students");
        assertEquals(12, e.position());
        assertEquals(EnumSet.of(TokenType.COMMA, TokenType.FROM), e.expected());
        assertEquals("identifier 'students'", e.found().toString());
    }

    @Test
    void danglingWhereReportsEndOfInput() {
        SyntaxException e = fails("SELECT * FROM t WHERE");
        assertEquals(21, e.position());
        assertEquals(TokenType.EOF, e.found().type());
        assertEquals(EnumSet.of(TokenType.IDENTIFIER), e.expected());
        assertTrue(e.getMessage().endsWith("but found end of input"), e.getMessage());
    }

    @Test
    void comparisonNeedsLiteralOperand() {
        SyntaxException e = fails("SELECT * FROM t WHERE a = b");
        assertEquals(26, e.position());
        assertEquals(EnumSet.of(TokenType.STRING_LITERAL, TokenType.NUMBER_LITERAL), e.expected());
    }

    @Test
    void trailingTokenListsEveryOptionalClause() {
        SyntaxException e = fails("SELECT * FROM t extra");
        assertEquals(16, e.position());
        assertEquals(EnumSet.of(TokenType.WHERE, TokenType.ORDER, TokenType.LIMIT, TokenType.SEMICOLON, TokenType.EOF), e.expected());
    }

    @Test
    void trailingTokenAfterComparisonAlsoAllowsAndOr() {
        SyntaxException e = fails("SELECT * FROM t WHERE a = 1 b");
        assertTrue(e.expected().containsAll(EnumSet.of(TokenType.AND, TokenType.OR, TokenType.ORDER, TokenType.EOF)));
    }

    @Test
    void orderRequiresBy() {
        SyntaxException e = fails("SELECT * FROM t ORDER age");
        assertEquals(EnumSet.of(TokenType.BY), e.expected());
    }

    @Test
    void emptyColumnAfterComma() {
        SyntaxException e = fails("SELECT a, FROM t");
        assertEquals(10, e.position());
        assertEquals(EnumSet.of(TokenType.IDENTIFIER), e.expected());
    }

    @Test
    void keywordCannotBeColumnName() {
        SyntaxException e = fails("SELECT order FROM t");
        assertEquals(7, e.position());
    }

    @Test
    void emptyQuery() {
        SyntaxException e = fails("");
        assertEquals(0, e.position());
        assertEquals(EnumSet.of(TokenType.SELECT), e.expected());
    }

    @Test
    void tokensMustEndWithEof() {
        assertThrows(IllegalArgumentException.class, () -> parser.parse(List.of(new Token(TokenType.SELECT, "SELECT", 0))));
    }

    @Test
    void parsesSelectDistinct() {
        SelectStatement s = parse("SELECT DISTINCT city FROM students");
        assertTrue(s.distinct());
        assertFalse(parse("SELECT city FROM students").distinct());
    }

    @Test
    void parsesIsNullForms() {
        BoolExpr.IsNull isNull = assertInstanceOf(BoolExpr.IsNull.class, parse("SELECT * FROM t WHERE a IS NULL").where());
        assertEquals(new Identifier("a", 22), isNull.column());
        assertFalse(isNull.negated());
        assertTrue(((BoolExpr.IsNull) parse("SELECT * FROM t WHERE a is not null").where()).negated());
    }

    @Test
    void betweenConsumesItsOwnAnd() {
        BoolExpr.And and = assertInstanceOf(BoolExpr.And.class,
            parse("SELECT * FROM t WHERE a BETWEEN 1 AND 5 AND b = 'x'").where());
        BoolExpr.Between between = assertInstanceOf(BoolExpr.Between.class, and.left());
        assertEquals(new Literal.NumberLiteral("1", 32), between.low());
        assertEquals(new Literal.NumberLiteral("5", 38), between.high());
        assertFalse(between.negated());
        assertEquals("b", column(and.right()));
    }

    @Test
    void parsesNotBetweenAndNotLike() {
        BoolExpr.Or or = assertInstanceOf(BoolExpr.Or.class,
            parse("SELECT * FROM t WHERE a NOT BETWEEN 'a' AND 'm' OR b NOT LIKE 'x%'").where());
        assertTrue(assertInstanceOf(BoolExpr.Between.class, or.left()).negated());
        BoolExpr.Like like = assertInstanceOf(BoolExpr.Like.class, or.right());
        assertTrue(like.negated());
        assertEquals("x%", like.pattern().value());
    }

    @Test
    void likeNeedsStringPattern() {
        SyntaxException e = fails("SELECT * FROM t WHERE a LIKE 5");
        assertEquals(29, e.position());
        assertEquals(EnumSet.of(TokenType.STRING_LITERAL), e.expected());
    }

    @Test
    void notMustPrefixBetweenOrLike() {
        SyntaxException e = fails("SELECT * FROM t WHERE a NOT = 1");
        assertEquals(28, e.position());
        assertEquals(EnumSet.of(TokenType.BETWEEN, TokenType.LIKE), e.expected());
    }

    @Test
    void isNeedsNull() {
        SyntaxException e = fails("SELECT * FROM t WHERE a IS 1");
        assertEquals(EnumSet.of(TokenType.NOT, TokenType.NULL), e.expected());
    }

    @Test
    void missingOperatorListsEveryColumnTest() {
        SyntaxException e = fails("SELECT * FROM t WHERE a 1");
        assertTrue(e.expected().containsAll(EnumSet.of(TokenType.EQ, TokenType.GE, TokenType.IS,
            TokenType.NOT, TokenType.BETWEEN, TokenType.LIKE)), e.expected().toString());
    }

    @Test
    void betweenNeedsAndBetweenBounds() {
        SyntaxException e = fails("SELECT * FROM t WHERE a BETWEEN 1 OR 5");
        assertEquals(EnumSet.of(TokenType.AND), e.expected());
    }
}
