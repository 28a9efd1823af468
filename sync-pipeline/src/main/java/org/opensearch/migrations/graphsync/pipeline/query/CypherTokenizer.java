package org.opensearch.migrations.graphsync.pipeline.query;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits Cypher text into tokens, recognizing string literals, backtick-quoted identifiers and comments
 * so that words inside them can never be mistaken for clauses.
 *
 * Comments are dropped. Every other token remembers the token that preceded it, which is what callers use
 * to tell a clause keyword ({@code SET n.x = 1}) from a property access ({@code n.set}) or a label
 * ({@code (n:Set)}).
 */
public final class CypherTokenizer {

    public enum TokenType {
        WORD,
        PARAMETER,
        STRING,
        QUOTED_IDENTIFIER,
        NUMBER,
        SYMBOL
    }

    public record Token(TokenType type, String text, Token previous) {
        public boolean isWord(String word) {
            return type == TokenType.WORD && text.equalsIgnoreCase(word);
        }

        public boolean isSymbol(char symbol) {
            return type == TokenType.SYMBOL && text.length() == 1 && text.charAt(0) == symbol;
        }

        public boolean follows(char symbol) {
            return previous != null && previous.isSymbol(symbol);
        }

        @Override
        public String toString() {
            return type + "(" + text + ")";
        }
    }

    public static class TokenizationException extends RuntimeException {
        public TokenizationException(String message) {
            super(message);
        }
    }

    private final String text;
    private int pos;
    private Token last;

    private CypherTokenizer(String text) {
        this.text = text;
    }

    public static List<Token> tokenize(String text) {
        return new CypherTokenizer(text).run();
    }

    private List<Token> run() {
        var tokens = new ArrayList<Token>();
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '/' && peek(1) == '/') {
                skipLineComment();
            } else if (c == '/' && peek(1) == '*') {
                skipBlockComment();
            } else if (c == '\'' || c == '"') {
                tokens.add(emit(TokenType.STRING, readString(c)));
            } else if (c == '`') {
                tokens.add(emit(TokenType.QUOTED_IDENTIFIER, readQuotedIdentifier()));
            } else if (c == '$') {
                tokens.add(emit(TokenType.PARAMETER, readParameter()));
            } else if (isWordStart(c)) {
                tokens.add(emit(TokenType.WORD, readWord()));
            } else if (Character.isDigit(c)) {
                tokens.add(emit(TokenType.NUMBER, readNumber()));
            } else {
                pos++;
                tokens.add(emit(TokenType.SYMBOL, String.valueOf(c)));
            }
        }
        return tokens;
    }

    private Token emit(TokenType type, String value) {
        last = new Token(type, value, last == null ? null : new Token(last.type, last.text, null));
        return last;
    }

    private char peek(int ahead) {
        int i = pos + ahead;
        return i < text.length() ? text.charAt(i) : '\0';
    }

    private void skipLineComment() {
        while (pos < text.length() && text.charAt(pos) != '\n') {
            pos++;
        }
    }

    private void skipBlockComment() {
        int end = text.indexOf("*/", pos + 2);
        if (end < 0) {
            throw new TokenizationException("Unterminated block comment starting at offset " + pos);
        }
        pos = end + 2;
    }

    private String readString(char quote) {
        int start = pos++;
        var value = new StringBuilder();
        while (pos < text.length()) {
            char c = text.charAt(pos++);
            if (c == '\\' && pos < text.length()) {
                value.append(text.charAt(pos++));
            } else if (c == quote) {
                return value.toString();
            } else {
                value.append(c);
            }
        }
        throw new TokenizationException("Unterminated string literal starting at offset " + start);
    }

    private String readQuotedIdentifier() {
        int start = pos++;
        var value = new StringBuilder();
        while (pos < text.length()) {
            char c = text.charAt(pos++);
            if (c == '`') {
                // `` inside a quoted identifier is an escaped backtick
                if (pos < text.length() && text.charAt(pos) == '`') {
                    value.append('`');
                    pos++;
                } else {
                    return value.toString();
                }
            } else {
                value.append(c);
            }
        }
        throw new TokenizationException("Unterminated quoted identifier starting at offset " + start);
    }

    private String readParameter() {
        pos++;
        if (pos < text.length() && text.charAt(pos) == '`') {
            return readQuotedIdentifier();
        }
        int start = pos;
        while (pos < text.length() && isWordPart(text.charAt(pos))) {
            pos++;
        }
        return text.substring(start, pos);
    }

    private String readWord() {
        int start = pos;
        while (pos < text.length() && isWordPart(text.charAt(pos))) {
            pos++;
        }
        return text.substring(start, pos);
    }

    /**
     * Reads an integer, decimal, exponent, hex ({@code 0x}) or octal ({@code 0o}) literal. A letter right
     * after the literal starts a new word: {@code LIMIT 1SET} is a limit followed by a SET clause.
     */
    private String readNumber() {
        int start = pos;
        if (text.charAt(pos) == '0' && (peek(1) == 'x' || peek(1) == 'X') && isHexDigit(peek(2))) {
            pos += 2;
            skipWhile(CypherTokenizer::isHexDigit);
            return text.substring(start, pos);
        }
        if (text.charAt(pos) == '0' && peek(1) == 'o' && isOctalDigit(peek(2))) {
            pos += 2;
            skipWhile(CypherTokenizer::isOctalDigit);
            return text.substring(start, pos);
        }
        skipWhile(Character::isDigit);
        if (peek(0) == '.' && Character.isDigit(peek(1))) {
            pos++;
            skipWhile(Character::isDigit);
        }
        if (peek(0) == 'e' || peek(0) == 'E') {
            int signWidth = (peek(1) == '+' || peek(1) == '-') ? 1 : 0;
            if (Character.isDigit(peek(1 + signWidth))) {
                pos += 1 + signWidth;
                skipWhile(Character::isDigit);
            }
        }
        return text.substring(start, pos);
    }

    private void skipWhile(CharPredicate predicate) {
        while (pos < text.length() && predicate.test(text.charAt(pos))) {
            pos++;
        }
    }

    @FunctionalInterface
    private interface CharPredicate {
        boolean test(char c);
    }

    private static boolean isHexDigit(char c) {
        return Character.digit(c, 16) >= 0;
    }

    private static boolean isOctalDigit(char c) {
        return c >= '0' && c <= '7';
    }

    private static boolean isWordStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isWordPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
