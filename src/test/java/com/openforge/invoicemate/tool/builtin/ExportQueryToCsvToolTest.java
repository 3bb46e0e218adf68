package com.openforge.invoicemate.tool.builtin;

import com.openforge.invoicemate.artifact.ArtifactIssuer;
import com.openforge.invoicemate.artifact.IssuedArtifact;
import com.openforge.invoicemate.error.RewriteException;
import com.openforge.invoicemate.sql.QueryExecutor;
import com.openforge.invoicemate.sql.QueryResult;
import com.openforge.invoicemate.tool.ToolInvocation;
import com.openforge.invoicemate.tool.ToolResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ExportQueryToCsvToolTest {

    private static final String SQL = "SELECT InvoiceID FROM Invoices";

    private QueryExecutor queryExecutor;
    private ArtifactIssuer issuer;
    private ExportQueryToCsvTool tool;

    @BeforeEach
    void setUp() {
        queryExecutor = mock(QueryExecutor.class);
        issuer = mock(ArtifactIssuer.class);
        tool = new ExportQueryToCsvTool(queryExecutor, issuer);
    }

    @Test
    void shouldExportAllRowsWithoutLimit() {
        QueryResult result = new QueryResult(List.of("InvoiceID"),
                List.of(Map.of("InvoiceID", "INV-1"), Map.of("InvoiceID", "INV-2")), false);
        when(queryExecutor.query(SQL, QueryExecutor.UNLIMITED)).thenReturn(result);
        when(issuer.issueCsv(result, "query_result", null)).thenReturn(new IssuedArtifact(
                "https://bucket.example.com/q.csv?sig=1", "20240302_101530_abc_query_result.csv",
                "sessiondumps/q.csv", Instant.parse("2024-03-02T11:15:30Z")));

        ToolResult out = tool.execute(new ToolInvocation("call-1", "conv-1", Map.of("sql_query", SQL)));

        assertTrue(out.success());
        assertEquals(2, out.payload().get("row_count"));
        assertEquals("https://bucket.example.com/q.csv?sig=1", out.payload().get("csv_url"));
        assertEquals("2024-03-02T11:15:30Z", out.payload().get("expires_at"));
    }

    @Test
    void shouldPassRequestedExpiryToIssuer() {
        QueryResult empty = new QueryResult(List.of("InvoiceID"), List.of(), false);
        when(queryExecutor.query(SQL, QueryExecutor.UNLIMITED)).thenReturn(empty);
        when(issuer.issueCsv(empty, "query_result", 5)).thenReturn(new IssuedArtifact(
                "u", "f.csv", "k", Instant.parse("2024-03-02T10:20:30Z")));

        ToolResult out = tool.execute(new ToolInvocation("call-1", "conv-1",
                Map.of("sql_query", SQL, "expiry_minutes", 5)));

        assertEquals(0, out.payload().get("row_count"));
        verify(issuer).issueCsv(empty, "query_result", 5);
    }

    @Test
    void shouldNotIssueWhenQueryFails() {
        when(queryExecutor.query(any(), anyInt())).thenThrow(new RewriteException("SIMILARITY() expects 2 arguments"));

        ToolInvocation invocation = new ToolInvocation("call-1", "conv-1", Map.of("sql_query", SQL));
        assertThrows(RewriteException.class, () -> tool.execute(invocation));
        verifyNoInteractions(issuer);
    }
}
