package com.openforge.invoicemate.sql;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexical scanner that splits SQL text into code tokens while stepping over
 * string literals, quoted identifiers and comments.
 *
 * It does not parse SQL. Its only job is to let callers find keywords and
 * punctuation that are really code, with exact offsets back into the input.
 * Whitespace and comments produce no tokens.
 */
public final class SqlScanner {

    public enum Kind {
        /** Bare identifier or keyword. */
        WORD,
        NUMBER,
        /** {@code '...'} or {@code N'...'}; {@code ''} escapes a quote. */
        STRING,
        /** {@code "..."}, {@code [...]} or {@code `...`}. */
        QUOTED_IDENTIFIER,
        /** Any other single character. */
        SYMBOL
    }

    public record Token(Kind kind, int start, int end, String text, boolean terminated) {

        public boolean isWord(String word) {
            return kind == Kind.WORD && text.equalsIgnoreCase(word);
        }

        public boolean isSymbol(char c) {
            return kind == Kind.SYMBOL && text.charAt(0) == c;
        }

        /** Decoded value of a STRING token: prefix and quotes removed, {@code ''} collapsed. */
        public String stringValue() {
            if (kind != Kind.STRING) {
                throw new IllegalStateException("Not a string literal: " + text);
            }
            int open = text.indexOf('\'');
            int close = terminated ? text.length() - 1 : text.length();
            return text.substring(open + 1, close).replace("''", "'");
        }
    }

    private SqlScanner() {
    }

    public static List<Token> tokenize(String sql) {
        List<Token> tokens = new ArrayList<>();
        int n = sql.length();
        int i = 0;
        while (i < n) {
            char c = sql.charAt(i);

            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '-' && i + 1 < n && sql.charAt(i + 1) == '-') {
                int eol = sql.indexOf('\n', i);
                i = eol < 0 ? n : eol + 1;
            } else if (c == '/' && i + 1 < n && sql.charAt(i + 1) == '*') {
                int close = sql.indexOf("*/", i + 2);
                i = close < 0 ? n : close + 2;
            } else if (c == '\'') {
                i = addQuoted(tokens, sql, i, i, '\'', Kind.STRING);
            } else if ((c == 'N' || c == 'n') && i + 1 < n && sql.charAt(i + 1) == '\'') {
                i = addQuoted(tokens, sql, i, i + 1, '\'', Kind.STRING);
            } else if (c == '"') {
                i = addQuoted(tokens, sql, i, i, '"', Kind.QUOTED_IDENTIFIER);
            } else if (c == '`') {
                i = addQuoted(tokens, sql, i, i, '`', Kind.QUOTED_IDENTIFIER);
            } else if (c == '[') {
                i = addQuoted(tokens, sql, i, i, ']', Kind.QUOTED_IDENTIFIER);
            } else if (isIdentifierPart(c)) {
                int end = i + 1;
                while (end < n && isIdentifierPart(sql.charAt(end))) end++;
                Kind kind = Character.isDigit(c) ? Kind.NUMBER : Kind.WORD;
                tokens.add(new Token(kind, i, end, sql.substring(i, end), true));
                i = end;
            } else {
                tokens.add(new Token(Kind.SYMBOL, i, i + 1, String.valueOf(c), true));
                i++;
            }
        }
        return tokens;
    }

    static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '@' || c == '#';
    }

    static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || Character.isDigit(c) || c == '$';
    }

    /**
     * Adds a token for a quoted region starting at {@code start} whose opening
     * delimiter sits at {@code open}. A doubled closing delimiter is an escape.
     */
    private static int addQuoted(List<Token> tokens, String sql, int start, int open, char close, Kind kind) {
        int n = sql.length();
        int i = open + 1;
        while (i < n) {
            if (sql.charAt(i) == close) {
                if (i + 1 < n && sql.charAt(i + 1) == close) {
                    i += 2;
                    continue;
                }
                tokens.add(new Token(kind, start, i + 1, sql.substring(start, i + 1), true));
                return i + 1;
            }
            i++;
        }
        tokens.add(new Token(kind, start, n, sql.substring(start), false));
        return n;
    }
}
