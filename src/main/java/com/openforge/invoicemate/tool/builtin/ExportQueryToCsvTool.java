package com.openforge.invoicemate.tool.builtin;

import com.openforge.invoicemate.artifact.ArtifactIssuer;
import com.openforge.invoicemate.artifact.IssuedArtifact;
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
 * Runs a query without the chat row limit and hands back a time-limited
 * download link to the CSV.
 */
@Slf4j
@RequiredArgsConstructor
public class ExportQueryToCsvTool implements BuiltinTool {

    public static final String NAME = "export_sql_query_to_csv_tool";

    private static final ToolSpec SPEC = new ToolSpec(NAME,
            "Execute a single read-only SELECT query and export all result rows as a CSV file. "
                    + "Returns a short-lived download link: {csv_url, filename, expires_at, row_count}. "
                    + "SIMILARITY(column, 'term') may be used exactly as in execute_sql_query_tool.",
            List.of(
                    ToolParameter.required("sql_query", ParameterType.STRING,
                            "A single SELECT statement to execute and export."),
                    ToolParameter.optional("expiry_minutes", ParameterType.INTEGER,
                            "How many minutes the download link stays valid. Default is 60.")));

    private static final String BASE_NAME = "query_result";

    private final QueryExecutor  queryExecutor;
    private final ArtifactIssuer issuer;

    @Override
    public ToolSpec spec() {
        return SPEC;
    }

    @Override
    public ToolResult execute(ToolInvocation invocation) {
        String sql = invocation.string("sql_query");
        QueryResult result = queryExecutor.query(sql, QueryExecutor.UNLIMITED);
        IssuedArtifact artifact = issuer.issueCsv(result, BASE_NAME, invocation.integer("expiry_minutes"));
        log.info("[Issuer] Exported {} row(s) to {}", result.rowCount(), artifact.filename());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("csv_url", artifact.url());
        payload.put("filename", artifact.filename());
        payload.put("expires_at", artifact.expiresAt().toString());
        payload.put("row_count", result.rowCount());
        return ToolResult.success(invocation.callId(), payload);
    }
}
