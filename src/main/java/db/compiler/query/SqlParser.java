package db.compiler.query;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for:
 * <pre>
 *   select_stmt  := SELECT [DISTINCT] column_list FROM IDENTIFIER [where_clause] [order_clause] [limit_clause] [';']
 *   column_list  := '*' | IDENTIFIER (',' IDENTIFIER)*
 *   where_clause := WHERE or_expr
 *   or_expr      := and_expr (OR and_expr)*
 *   and_expr     := comparison (AND comparison)*
 *   comparison   := IDENTIFIER comp_op literal
 *                 | IDENTIFIER IS [NOT] NULL
 *                 | IDENTIFIER [NOT] BETWEEN literal AND literal
 *                 | IDENTIFIER [NOT] LIKE STRING_LITERAL
 *   comp_op      := '=' | '!=' | '&lt;&gt;' | '&lt;' | '&gt;' | '&lt;=' | '&gt;='
 *   literal      := STRING_LITERAL | NUMBER_LITERAL
 *   order_clause := ORDER BY IDENTIFIER [ASC | DESC]
 *   limit_clause := LIMIT NUMBER_LITERAL [OFFSET NUMBER_LITERAL]
 * </pre>
 * AND binds tighter than OR and both chains are left-associative. There are no
 * parenthesized sub-expressions. Parsing stops at the first mismatching token.
 * The parser keeps no state between calls.
 */
public class SqlParser {
    private static final Set<TokenType> COMPARISON_OPS =
            EnumSet.of(TokenType.EQ, TokenType.NE, TokenType.LT, TokenType.GT, TokenType.LE, TokenType.GE);
    private static final Set<TokenType> LITERALS =
            EnumSet.of(TokenType.STRING_LITERAL, TokenType.NUMBER_LITERAL);

    public SelectStatement parse(List<Token> tokens) {
        if (tokens == null || tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.EOF) {
            throw new IllegalArgumentException("token sequence must end with EOF");
        }
        return new Cursor(tokens).selectStatement();
    }

    /** Parse position over one token sequence. */
    private static final class Cursor {
        private final List<Token> tokens;
        private int pos;
        // Kinds that would also have been accepted at the current position (optional clauses already tried)
        private final EnumSet<TokenType> pending = EnumSet.noneOf(TokenType.class);

        Cursor(List<Token> tokens) {
            this.tokens = tokens;
        }

        SelectStatement selectStatement() {
            expect(TokenType.SELECT);
            boolean distinct = match(TokenType.DISTINCT);
            SelectList columns = selectList();
            expect(TokenType.FROM);
            Token tableToken = expect(TokenType.IDENTIFIER);
            Identifier table = new Identifier(tableToken.text(), tableToken.position());

            BoolExpr where = null;
            if (match(TokenType.WHERE)) {
                where = orExpression();
            }
            OrderBy orderBy = null;
            if (match(TokenType.ORDER)) {
                orderBy = orderClause();
            }
            LimitClause limit = null;
            if (match(TokenType.LIMIT)) {
                limit = limitClause();
            }
            match(TokenType.SEMICOLON);
            expect(TokenType.EOF);
            return new SelectStatement(columns, table, where, orderBy, limit, distinct);
        }

        private SelectList selectList() {
            Token star = current();
            if (match(TokenType.STAR)) {
                return new SelectList.All(star.position());
            }
            List<Identifier> columns = new ArrayList<>();
            do {
                Token col = expect(TokenType.IDENTIFIER);
                columns.add(new Identifier(col.text(), col.position()));
            } while (match(TokenType.COMMA));
            return new SelectList.Columns(columns);
        }

        // or_expr := and_expr (OR and_expr)*
        private BoolExpr orExpression() {
            BoolExpr left = andExpression();
            while (match(TokenType.OR)) {
                BoolExpr right = andExpression();
                left = new BoolExpr.Or(left, right);
            }
            return left;
        }

        // and_expr := comparison (AND comparison)*
        private BoolExpr andExpression() {
            BoolExpr left = comparison();
            while (match(TokenType.AND)) {
                BoolExpr right = comparison();
                left = new BoolExpr.And(left, right);
            }
            return left;
        }

        private BoolExpr comparison() {
            Token col = expect(TokenType.IDENTIFIER);
            Identifier column = new Identifier(col.text(), col.position());
            if (match(TokenType.IS)) {
                boolean negated = match(TokenType.NOT);
                expect(TokenType.NULL);
                return new BoolExpr.IsNull(column, negated);
            }
            boolean negated = match(TokenType.NOT);
            if (match(TokenType.BETWEEN)) {
                Literal low = literal();
                expect(TokenType.AND);
                Literal high = literal();
                return new BoolExpr.Between(column, low, high, negated);
            }
            if (match(TokenType.LIKE)) {
                Token pattern = expect(TokenType.STRING_LITERAL);
                return new BoolExpr.Like(column, new Literal.StringLiteral(pattern.text(), pattern.position()), negated);
            }
            if (negated) {
                // NOT only prefixes BETWEEN and LIKE
                throw new SyntaxException(EnumSet.of(TokenType.BETWEEN, TokenType.LIKE), current());
            }
            Token op = expectOneOf(COMPARISON_OPS);
            return new BoolExpr.Comparison(column, op, literal());
        }

        private Literal literal() {
            Token lit = expectOneOf(LITERALS);
            return lit.type() == TokenType.STRING_LITERAL
                    ? new Literal.StringLiteral(lit.text(), lit.position())
                    : new Literal.NumberLiteral(lit.text(), lit.position());
        }

        private OrderBy orderClause() {
            expect(TokenType.BY);
            Token col = expect(TokenType.IDENTIFIER);
            SortDirection direction = SortDirection.ASC;
            if (match(TokenType.ASC)) {
                direction = SortDirection.ASC;
            } else if (match(TokenType.DESC)) {
                direction = SortDirection.DESC;
            }
            return new OrderBy(new Identifier(col.text(), col.position()), direction);
        }

        private LimitClause limitClause() {
            Token count = expect(TokenType.NUMBER_LITERAL);
            Literal.NumberLiteral offset = null;
            if (match(TokenType.OFFSET)) {
                Token skip = expect(TokenType.NUMBER_LITERAL);
                offset = new Literal.NumberLiteral(skip.text(), skip.position());
            }
            return new LimitClause(new Literal.NumberLiteral(count.text(), count.position()), offset);
        }

        private Token current() {
            return tokens.get(pos);
        }

        // Never moves past the trailing EOF token.
        private Token advance() {
            Token t = tokens.get(pos);
            if (t.type() != TokenType.EOF) pos++;
            pending.clear();
            return t;
        }

        private boolean match(TokenType type) {
            if (current().type() == type) {
                advance();
                return true;
            }
            pending.add(type);
            return false;
        }

        private Token expect(TokenType type) {
            return expectOneOf(EnumSet.of(type));
        }

        private Token expectOneOf(Set<TokenType> kinds) {
            if (kinds.contains(current().type())) {
                return advance();
            }
            EnumSet<TokenType> expected = EnumSet.copyOf(kinds);
            expected.addAll(pending);
            throw new SyntaxException(expected, current());
        }
    }
}
