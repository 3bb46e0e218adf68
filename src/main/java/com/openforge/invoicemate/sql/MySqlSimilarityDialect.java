package com.openforge.invoicemate.sql;

/**
 * MySQL flavour: {@code LOCATE} and {@code TRIM}. The same SQL runs on H2 in
 * MySQL compatibility mode.
 */
public class MySqlSimilarityDialect implements SimilarityDialect {

    @Override
    public String name() {
        return "mysql";
    }

    @Override
    public String literal(String value) {
        return SimilarityDialect.quote(value);
    }

    @Override
    public String position(String needle, String haystack) {
        return "LOCATE(" + needle + ", " + haystack + ")";
    }

    @Override
    public String trim(String expression) {
        return "TRIM(" + expression + ")";
    }
}
