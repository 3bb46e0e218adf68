package com.openforge.invoicemate.sql;

import com.openforge.invoicemate.error.RewriteException;
import com.openforge.invoicemate.sql.SqlScanner.Kind;
import com.openforge.invoicemate.sql.SqlScanner.Token;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Expands every {@code SIMILARITY(column, 'term')} pseudo-function call into a
 * numeric scoring expression the database can evaluate.
 *
 * Only calls that are real code are considered: the keyword inside a string
 * literal, a quoted identifier or a comment is left alone, as is a qualified
 * call such as {@code dbo.SIMILARITY(...)}. Everything outside the replaced
 * spans is copied through unchanged. The generated SQL never contains the
 * keyword, so running the rewriter on its own output is a no-op.
 *
 * Stateless and thread-safe.
 */
@Slf4j
public class SimilarityRewriter {

    static final String FUNCTION_NAME = "SIMILARITY";

    private final SimilarityDialect dialect;

    public SimilarityRewriter(SimilarityDialect dialect) {
        this.dialect = dialect;
    }

    public SimilarityDialect dialect() {
        return dialect;
    }

    public RewrittenQuery rewrite(String sql) {
        if (sql == null) {
            throw new RewriteException("SQL must not be null");
        }
        List<Token> tokens = SqlScanner.tokenize(sql);
        List<SimilarityExpression> found = new ArrayList<>();
        StringBuilder out = new StringBuilder(sql.length() + 256);
        int copied = 0;

        int i = 0;
        while (i < tokens.size()) {
            if (!isCallStart(tokens, i)) {
                i++;
                continue;
            }
            int close = findClosingParen(tokens, i + 1, sql);
            SimilarityExpression expression = parseCall(sql, tokens, i, close);
            found.add(expression);

            out.append(sql, copied, expression.start());
            out.append(dialect.scoreExpression(expression.column(), SimilarityTerm.of(expression.term())));
            copied = expression.end();
            i = close + 1;
        }

        if (found.isEmpty()) {
            return new RewrittenQuery(sql, sql, List.of());
        }
        out.append(sql, copied, sql.length());
        log.debug("[Rewriter] Expanded {} SIMILARITY call(s) for dialect {}", found.size(), dialect.name());
        return new RewrittenQuery(sql, out.toString(), found);
    }

    // ── Call recognition ─────────────────────────────────────────────────────

    private static boolean isCallStart(List<Token> tokens, int i) {
        Token token = tokens.get(i);
        if (!token.isWord(FUNCTION_NAME)) return false;
        if (i + 1 >= tokens.size() || !tokens.get(i + 1).isSymbol('(')) return false;
        return i == 0 || !tokens.get(i - 1).isSymbol('.');
    }

    /** Index of the token closing the parenthesis opened at {@code open}. */
    private static int findClosingParen(List<Token> tokens, int open, String sql) {
        int depth = 0;
        for (int j = open; j < tokens.size(); j++) {
            Token t = tokens.get(j);
            if (!t.terminated()) break;
            if (t.isSymbol('(')) depth++;
            else if (t.isSymbol(')') && --depth == 0) return j;
        }
        throw new RewriteException("Unterminated SIMILARITY call at offset %d: %s"
                .formatted(tokens.get(open - 1).start(), excerpt(sql, tokens.get(open - 1).start())));
    }

    private static SimilarityExpression parseCall(String sql, List<Token> tokens, int nameIdx, int closeIdx) {
        List<List<Token>> args = new ArrayList<>();
        List<Token> current = new ArrayList<>();
        int depth = 0;
        for (int j = nameIdx + 2; j < closeIdx; j++) {
            Token t = tokens.get(j);
            if (t.isSymbol('(')) depth++;
            if (t.isSymbol(')')) depth--;
            if (depth == 0 && t.isSymbol(',')) {
                args.add(current);
                current = new ArrayList<>();
            } else {
                current.add(t);
            }
        }
        args.add(current);

        int start = tokens.get(nameIdx).start();
        int end = tokens.get(closeIdx).end();
        String call = sql.substring(start, end);

        if (args.size() != 2) {
            throw new RewriteException("SIMILARITY expects 2 arguments (column, 'term') but got %d: %s"
                    .formatted(args.get(0).isEmpty() && args.size() == 1 ? 0 : args.size(), call));
        }
        List<Token> columnArg = args.get(0);
        List<Token> termArg = args.get(1);

        if (!isColumnReference(columnArg)) {
            throw new RewriteException("First SIMILARITY argument must be a column reference: " + call);
        }
        if (termArg.size() != 1 || termArg.get(0).kind() != Kind.STRING) {
            throw new RewriteException("Second SIMILARITY argument must be a single string literal: " + call);
        }
        String term = termArg.get(0).stringValue();
        if (term.isBlank() || SimilarityTerm.normalize(term).isEmpty()) {
            throw new RewriteException("SIMILARITY search term must not be empty: " + call);
        }

        String column = sql.substring(columnArg.get(0).start(), columnArg.get(columnArg.size() - 1).end());
        return new SimilarityExpression(start, end, column, term);
    }

    /** {@code part(.part)*} where each part is a bare or quoted identifier. */
    private static boolean isColumnReference(List<Token> arg) {
        if (arg.isEmpty() || arg.size() % 2 == 0) return false;
        for (int k = 0; k < arg.size(); k++) {
            Token t = arg.get(k);
            boolean ok = k % 2 == 0
                    ? (t.kind() == Kind.WORD || t.kind() == Kind.QUOTED_IDENTIFIER) && t.terminated()
                    : t.isSymbol('.');
            if (!ok) return false;
        }
        return true;
    }

    private static String excerpt(String sql, int from) {
        String tail = sql.substring(from);
        return tail.length() > 60 ? tail.substring(0, 60) + "..." : tail;
    }
}
