package com.openforge.invoicemate.sql;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * A search term prepared for scoring: upper-cased and normalized in Java so
 * the generated SQL only compares against constants.
 */
public record SimilarityTerm(String raw, String upper, String normalized, List<String> normalizedVariants) {

    /** Characters removed by normalization, on both the term and the column side. */
    public static final String STRIPPED_CHARACTERS = " ,.-'/&()";

    /** Trailing legal-entity suffixes tolerated by normalized equality. */
    public static final List<String> LEGAL_SUFFIXES = List.of(
            "INC", "LLC", "LTD", "CORP", "CO", "GMBH", "PLC", "LIMITED", "CORPORATION", "COMPANY");

    public static SimilarityTerm of(String raw) {
        String upper = raw.strip().toUpperCase(Locale.ROOT);
        String normalized = normalize(raw);

        Set<String> variants = new LinkedHashSet<>();
        variants.add(normalized);
        for (String suffix : LEGAL_SUFFIXES) {
            variants.add(normalized + suffix);
            if (normalized.endsWith(suffix) && normalized.length() > suffix.length()) {
                variants.add(normalized.substring(0, normalized.length() - suffix.length()));
            }
        }
        return new SimilarityTerm(raw, upper, normalized, List.copyOf(variants));
    }

    static String normalize(String value) {
        String upper = value.strip().toUpperCase(Locale.ROOT);
        StringBuilder sb = new StringBuilder(upper.length());
        for (int i = 0; i < upper.length(); i++) {
            char c = upper.charAt(i);
            if (!Character.isWhitespace(c) && STRIPPED_CHARACTERS.indexOf(c) < 0) {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
