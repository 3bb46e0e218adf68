package com.openforge.invoicemate.sql;

import com.openforge.invoicemate.error.ValidationException;
import com.openforge.invoicemate.sql.SqlScanner.Kind;
import com.openforge.invoicemate.sql.SqlScanner.Token;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Refuses anything but a single read-only statement.
 *
 * Accepted: one {@code SELECT} or {@code WITH ... SELECT} statement, optionally
 * followed by one trailing semicolon. {@code SELECT ... INTO} is refused.
 * Words like {@code Update} or {@code Call} are fine as column names or
 * aliases: only the statement that follows a {@code WITH} list and the
 * {@code INTO} clause are checked. Literals, quoted identifiers and comments
 * are ignored.
 */
public final class ReadOnlyQueryGuard {

    private static final Set<String> LEADING_KEYWORDS = Set.of("SELECT", "WITH");

    /** Tokens after which {@code INTO} is a column name or alias, not a clause. */
    private static final Set<String> NAME_CONTEXT = Set.of("SELECT", "AS", "BY", "DISTINCT");

    /** Words that may follow an {@code Into} column; an INTO clause names its target instead. */
    private static final Set<String> CLAUSE_WORDS = Set.of(
            "FROM", "WHERE", "GROUP", "ORDER", "HAVING", "UNION", "EXCEPT", "INTERSECT", "LIMIT", "OFFSET",
            "FETCH", "FOR", "ASC", "DESC", "AND", "OR", "AS", "ON", "JOIN", "INNER", "LEFT", "RIGHT", "FULL",
            "CROSS", "OUTER", "IS", "IN", "NOT", "LIKE", "BETWEEN", "WHEN", "THEN", "ELSE", "END");

    private ReadOnlyQueryGuard() {
    }

    /**
     * Validates {@code sql} and returns it with any trailing semicolon removed.
     *
     * @throws ValidationException if the statement is empty, not a query, or
     *                             contains more than one statement
     */
    public static String check(String sql) {
        if (sql == null || sql.isBlank()) {
            throw new ValidationException("SQL query must not be empty.");
        }
        List<Token> tokens = SqlScanner.tokenize(sql);
        if (tokens.isEmpty()) {
            throw new ValidationException("SQL query must not be empty.");
        }

        Token first = tokens.get(0);
        if (first.kind() != Kind.WORD || !LEADING_KEYWORDS.contains(upper(first))) {
            throw new ValidationException("Only SELECT queries are allowed.");
        }

        int cut = sql.length();
        for (int i = 0; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.isSymbol(';')) {
                if (i != tokens.size() - 1) {
                    throw new ValidationException("Multiple SQL statements are not allowed.");
                }
                cut = t.start();
            } else if (t.isWord("INTO") && isIntoClause(tokens, i)) {
                throw new ValidationException("Only read-only queries are allowed; found INTO.");
            }
        }
        if (first.isWord("WITH")) {
            Token main = statementAfterWith(tokens);
            if (main == null || !(main.isWord("SELECT") || main.isSymbol('('))) {
                throw new ValidationException("Only read-only queries are allowed; found "
                        + (main == null ? "no statement" : upper(main)) + " after WITH.");
            }
        }
        return sql.substring(0, cut).strip();
    }

    private static boolean isIntoClause(List<Token> tokens, int i) {
        Token prev = tokens.get(i - 1);
        if (prev.isSymbol(',') || prev.isSymbol('.') || (prev.kind() == Kind.WORD && NAME_CONTEXT.contains(upper(prev)))) {
            return false;
        }
        if (i + 1 >= tokens.size()) {
            return false;
        }
        Token next = tokens.get(i + 1);
        return next.kind() == Kind.QUOTED_IDENTIFIER
                || (next.kind() == Kind.WORD && !CLAUSE_WORDS.contains(upper(next)));
    }

    /**
     * The first top-level token after the CTE list
     * {@code name [(cols)] AS (body) [, ...]}, or null when there is none.
     */
    private static Token statementAfterWith(List<Token> tokens) {
        int depth = 0;
        for (int i = 1; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.isSymbol('(')) {
                depth++;
            } else if (t.isSymbol(')')) {
                depth--;
                if (depth == 0 && i + 1 < tokens.size()) {
                    Token next = tokens.get(i + 1);
                    if (!next.isSymbol(',') && !next.isWord("AS")) {
                        return next.isSymbol(';') ? null : next;
                    }
                }
            }
        }
        return null;
    }

    private static String upper(Token t) {
        return t.text().toUpperCase(Locale.ROOT);
    }
}
