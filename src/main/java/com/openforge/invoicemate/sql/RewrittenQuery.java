package com.openforge.invoicemate.sql;

import java.util.List;

/**
 * Result of {@link SimilarityRewriter#rewrite(String)}.
 */
public record RewrittenQuery(String originalSql, String sql, List<SimilarityExpression> expressions) {

    public RewrittenQuery {
        expressions = List.copyOf(expressions);
    }

    public boolean rewritten() {
        return !expressions.isEmpty();
    }
}
