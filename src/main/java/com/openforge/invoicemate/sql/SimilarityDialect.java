package com.openforge.invoicemate.sql;

import java.util.stream.Collectors;

/**
 * Engine-specific SQL fragments used to expand {@code SIMILARITY(column, 'term')}
 * into a scoring {@code CASE} expression.
 *
 * Tiers, first match wins:
 * <pre>
 *   100  exact, case-insensitive
 *    90  term is a prefix of the column
 *    83/81  term found at position 2 or 3
 *    80  term found further in
 *    75  normalized equality (one legal suffix tolerated)
 *    70  same SOUNDEX code
 *    65  normalized term contained in normalized column
 *     0  otherwise
 * </pre>
 */
public interface SimilarityDialect {

    /** Configuration name, e.g. "mysql". */
    String name();

    /** A SQL string literal for {@code value}. */
    String literal(String value);

    /** 1-based position of {@code needle} in {@code haystack}, 0 when absent. */
    String position(String needle, String haystack);

    String trim(String expression);

    default String upper(String expression) {
        return "UPPER(" + expression + ")";
    }

    /** Upper-cases, trims and strips {@link SimilarityTerm#STRIPPED_CHARACTERS}. */
    default String normalize(String expression) {
        String result = upper(trim(expression));
        for (char c : SimilarityTerm.STRIPPED_CHARACTERS.toCharArray()) {
            result = "REPLACE(" + result + ", " + literal(String.valueOf(c)) + ", '')";
        }
        return result;
    }

    default String scoreExpression(String column, SimilarityTerm term) {
        String upperColumn = upper(column);
        String upperTerm = literal(term.upper());
        String pos = position(upperTerm, upperColumn);
        String normalizedColumn = normalize(column);
        String variants = term.normalizedVariants().stream()
                .map(this::literal)
                .collect(Collectors.joining(", "));

        return "(CASE"
                + " WHEN " + upperColumn + " = " + upperTerm + " THEN 100"
                + " WHEN " + pos + " = 1 THEN 90"
                + " WHEN " + pos + " BETWEEN 2 AND 3 THEN 85 - (" + pos + " - 1) * 2"
                + " WHEN " + pos + " > 0 THEN 80"
                + " WHEN " + normalizedColumn + " IN (" + variants + ") THEN 75"
                + " WHEN SOUNDEX(" + column + ") = SOUNDEX(" + literal(term.raw().strip()) + ") THEN 70"
                + " WHEN " + position(literal(term.normalized()), normalizedColumn) + " > 0 THEN 65"
                + " ELSE 0 END)";
    }

    static String quote(String value) {
        return "'" + value.replace("'", "''") + "'";
    }
}
