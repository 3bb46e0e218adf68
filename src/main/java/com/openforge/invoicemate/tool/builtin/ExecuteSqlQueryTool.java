package com.openforge.invoicemate.tool.builtin;

import com.openforge.invoicemate.sql.QueryExecutor;
import com.openforge.invoicemate.sql.QueryResult;
import com.openforge.invoicemate.tool.ParameterType;
import com.openforge.invoicemate.tool.ToolInvocation;
import com.openforge.invoicemate.tool.ToolParameter;
import com.openforge.invoicemate.tool.ToolResult;
import com.openforge.invoicemate.tool.ToolSpec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs one read-only query for the model and returns the rows inline.
 */
@Slf4j
@RequiredArgsConstructor
public class ExecuteSqlQueryTool implements BuiltinTool {

    public static final String NAME = "execute_sql_query_tool";

    private static final ToolSpec SPEC = new ToolSpec(NAME,
            """
            Execute a read-only SELECT query against the invoice database. \
            Only a single SELECT (or WITH ... SELECT) statement is permitted; any other SQL is rejected.
            Fuzzy matching is available through the pseudo-function
              SIMILARITY(ColumnName, 'search_term')
            which returns a 0-100 score (100 exact, 90 prefix, 75 same name ignoring punctuation \
            and legal suffixes, 70 sounds alike, 0 unrelated).
            Filter with WHERE SIMILARITY(...) >= <threshold> (e.g. 60) and order by the score.
            Example:
              SELECT VendorName, SIMILARITY(VendorName, 'Acme') AS SimScore
                FROM Invoices
               WHERE SIMILARITY(VendorName, 'Acme') >= 60
               ORDER BY SimScore DESC
            Available tables and columns:
            {{schema}}""",
            List.of(ToolParameter.required("sql_query", ParameterType.STRING,
                    "A single SELECT statement. Use SIMILARITY(column, 'term') with a WHERE ... >= threshold "
                            + "for fuzzy matching on text columns.")));

    private final QueryExecutor queryExecutor;

    @Override
    public ToolSpec spec() {
        return SPEC;
    }

    @Override
    public ToolResult execute(ToolInvocation invocation) {
        String sql = invocation.string("sql_query");
        log.info("[Query] {} for conversation {}: {}", NAME, invocation.conversationId(), sql);
        QueryResult result = queryExecutor.query(sql);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("results", result.rows());
        payload.put("row_count", result.rowCount());
        payload.put("truncated", result.truncated());
        return ToolResult.success(invocation.callId(), payload);
    }
}
