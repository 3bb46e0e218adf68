package com.openforge.invoicemate.sql;

import com.openforge.invoicemate.error.ExecutionFailedException;
import com.openforge.invoicemate.error.RewriteException;
import com.openforge.invoicemate.error.ValidationException;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class QueryExecutorTest {

    private static QueryExecutor executor;

    @BeforeAll
    static void setUp() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
                "jdbc:h2:mem:executor;MODE=MySQL;DB_CLOSE_DELAY=-1", "sa", "");
        JdbcTemplate jdbc = new JdbcTemplate(dataSource);
        jdbc.execute("DROP TABLE IF EXISTS Invoices");
        jdbc.execute("CREATE TABLE Invoices (InvoiceID VARCHAR(20), InvoiceDate DATE, "
                + "InvoiceTotal DECIMAL(18,2), ProcessedAt TIMESTAMP)");
        for (int i = 1; i <= 5; i++) {
            jdbc.update("INSERT INTO Invoices VALUES (?, DATE '2024-03-0" + i + "', ?, TIMESTAMP '2024-03-0" + i + " 10:15:30')",
                    "INV-" + i, new java.math.BigDecimal("1000.50").multiply(java.math.BigDecimal.valueOf(i)));
        }
        SqlProperties properties = new SqlProperties("mysql", Duration.ofSeconds(10), 3,
                Duration.ofMinutes(5), List.of("Invoices"));
        executor = new QueryExecutor(dataSource, new SimilarityRewriter(new MySqlSimilarityDialect()), properties);
    }

    @Test
    void shouldReturnColumnsInSelectOrder() {
        QueryResult result = executor.query("SELECT InvoiceTotal, InvoiceID FROM Invoices WHERE InvoiceID = 'INV-1'");

        assertEquals(List.of("INVOICETOTAL", "INVOICEID"), result.columns());
        assertFalse(result.truncated());
    }

    @Test
    void shouldMakeValuesJsonFriendly() {
        Map<String, Object> row = executor.query(
                "SELECT InvoiceTotal, InvoiceDate, ProcessedAt FROM Invoices WHERE InvoiceID = 'INV-2';").rows().get(0);

        assertEquals("2001.00", row.get("INVOICETOTAL"));
        assertEquals("2024-03-02", row.get("INVOICEDATE"));
        assertEquals("2024-03-02T10:15:30", row.get("PROCESSEDAT"));
    }

    @Test
    void shouldTruncateAtDefaultRowLimit() {
        QueryResult result = executor.query("SELECT InvoiceID FROM Invoices ORDER BY InvoiceID");

        assertEquals(3, result.rowCount());
        assertTrue(result.truncated());
    }

    @Test
    void shouldReturnAllRowsWhenUnlimited() {
        QueryResult result = executor.query("SELECT InvoiceID FROM Invoices", QueryExecutor.UNLIMITED);

        assertEquals(5, result.rowCount());
        assertFalse(result.truncated());
    }

    @Test
    void shouldReturnEmptyResultWithColumns() {
        QueryResult result = executor.query("SELECT InvoiceID, InvoiceTotal FROM Invoices WHERE 1 = 0");

        assertEquals(0, result.rowCount());
        assertEquals(2, result.columns().size());
    }

    @Test
    void shouldRejectWritesBeforeTouchingDatabase() {
        assertThrows(ValidationException.class, () -> executor.query("DELETE FROM Invoices"));
        assertEquals(5, executor.query("SELECT * FROM Invoices", QueryExecutor.UNLIMITED).rowCount());
    }

    @Test
    void shouldSurfaceRewriteErrors() {
        assertThrows(RewriteException.class,
                () -> executor.query("SELECT SIMILARITY(InvoiceID) FROM Invoices"));
    }

    @Test
    void shouldReportDriverMessageForBadSql() {
        ExecutionFailedException ex = assertThrows(ExecutionFailedException.class,
                () -> executor.query("SELECT NoSuchColumn FROM Invoices"));

        assertTrue(ex.getMessage().startsWith("Database error:"));
        assertTrue(ex.getMessage().toUpperCase().contains("NOSUCHCOLUMN"));
    }
}
