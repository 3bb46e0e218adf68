package com.openforge.invoicemate.sql;

import java.util.List;
import java.util.Map;

/**
 * Rows returned by {@link QueryExecutor}, column order preserved.
 *
 * @param truncated true when more rows matched than the row limit allowed
 */
public record QueryResult(List<String> columns, List<Map<String, Object>> rows, boolean truncated) {

    public int rowCount() {
        return rows.size();
    }
}
