package db.compiler.query;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits query text into tokens, left to right, skipping whitespace.
 * Always ends the sequence with an EOF token positioned at the end of the text.
 */
public class SqlLexer {

    public List<Token> tokenize(String text) {
        if (text == null) throw new IllegalArgumentException("query text must not be null");
        List<Token> tokens = new ArrayList<>();
        int index = 0;
        while (index < text.length()) {
            char ch = text.charAt(index);
            if (Character.isWhitespace(ch)) {
                index++;
                continue;
            }
            if (ch == '\'' || ch == '"') {
                index = readString(text, index, tokens);
                continue;
            }
            if (isDigit(ch)) {
                index = readNumber(text, index, tokens);
                continue;
            }
            if (isIdentifierStart(ch)) {
                index = readWord(text, index, tokens);
                continue;
            }
            index = readOperator(text, index, tokens);
        }
        tokens.add(new Token(TokenType.EOF, "", text.length()));
        return tokens;
    }

    // Quoted literal; the matching quote ends it, there are no escape sequences.
    private int readString(String text, int quoteIndex, List<Token> tokens) {
        char quote = text.charAt(quoteIndex);
        int close = text.indexOf(quote, quoteIndex + 1);
        if (close < 0) {
            throw new LexException("unterminated string literal", quoteIndex);
        }
        tokens.add(new Token(TokenType.STRING_LITERAL, text.substring(quoteIndex + 1, close), quoteIndex));
        return close + 1;
    }

    // Integer or decimal; a '.' only belongs to the number when a digit follows it.
    private int readNumber(String text, int start, List<Token> tokens) {
        int index = start;
        while (index < text.length() && isDigit(text.charAt(index))) index++;
        if (index + 1 < text.length() && text.charAt(index) == '.' && isDigit(text.charAt(index + 1))) {
            index++;
            while (index < text.length() && isDigit(text.charAt(index))) index++;
        }
        tokens.add(new Token(TokenType.NUMBER_LITERAL, text.substring(start, index), start));
        return index;
    }

    private int readWord(String text, int start, List<Token> tokens) {
        int index = start;
        while (index < text.length() && isIdentifierPart(text.charAt(index))) index++;
        String word = text.substring(start, index);
        TokenType keyword = TokenType.keyword(word);
        tokens.add(new Token(keyword != null ? keyword : TokenType.IDENTIFIER, word, start));
        return index;
    }

    private int readOperator(String text, int index, List<Token> tokens) {
        char ch = text.charAt(index);
        char next = index + 1 < text.length() ? text.charAt(index + 1) : '\0';
        switch (ch) {
            case '=' -> tokens.add(new Token(TokenType.EQ, "=", index));
            case '*' -> tokens.add(new Token(TokenType.STAR, "*", index));
            case ',' -> tokens.add(new Token(TokenType.COMMA, ",", index));
            case ';' -> tokens.add(new Token(TokenType.SEMICOLON, ";", index));
            case '!' -> {
                if (next != '=') throw new LexException("unrecognized character '!'", index);
                tokens.add(new Token(TokenType.NE, "!=", index));
                return index + 2;
            }
            case '<' -> {
                if (next == '=') {
                    tokens.add(new Token(TokenType.LE, "<=", index));
                    return index + 2;
                }
                if (next == '>') {
                    tokens.add(new Token(TokenType.NE, "<>", index));
                    return index + 2;
                }
                tokens.add(new Token(TokenType.LT, "<", index));
            }
            case '>' -> {
                if (next == '=') {
                    tokens.add(new Token(TokenType.GE, ">=", index));
                    return index + 2;
                }
                tokens.add(new Token(TokenType.GT, ">", index));
            }
            default -> throw new LexException("unrecognized character '" + ch + "'", index);
        }
        return index + 1;
    }

    private static boolean isDigit(char ch) {
        return ch >= '0' && ch <= '9';
    }

    private static boolean isIdentifierStart(char ch) {
        return Character.isLetter(ch) || ch == '_';
    }

    private static boolean isIdentifierPart(char ch) {
        return Character.isLetterOrDigit(ch) || ch == '_';
    }
}
