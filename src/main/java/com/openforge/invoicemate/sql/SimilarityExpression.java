package com.openforge.invoicemate.sql;

/**
 * One {@code SIMILARITY(column, 'term')} occurrence found in a query.
 *
 * @param start  offset of the {@code SIMILARITY} keyword in the original SQL
 * @param end    offset just past the closing parenthesis
 * @param column column reference, verbatim
 * @param term   decoded search term
 */
public record SimilarityExpression(int start, int end, String column, String term) {
}
