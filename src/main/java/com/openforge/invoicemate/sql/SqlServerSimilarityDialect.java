package com.openforge.invoicemate.sql;

/**
 * SQL Server flavour: {@code CHARINDEX}, {@code LTRIM(RTRIM())} and
 * national-character literals.
 */
public class SqlServerSimilarityDialect implements SimilarityDialect {

    @Override
    public String name() {
        return "sqlserver";
    }

    @Override
    public String literal(String value) {
        return "N" + SimilarityDialect.quote(value);
    }

    @Override
    public String position(String needle, String haystack) {
        return "CHARINDEX(" + needle + ", " + haystack + ")";
    }

    @Override
    public String trim(String expression) {
        return "LTRIM(RTRIM(" + expression + "))";
    }
}
