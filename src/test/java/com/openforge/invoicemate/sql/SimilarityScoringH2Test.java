package com.openforge.invoicemate.sql;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs rewritten queries on H2 in MySQL mode to check the scores the
 * database actually computes.
 */
class SimilarityScoringH2Test {

    private static QueryExecutor executor;

    @BeforeAll
    static void setUp() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
                "jdbc:h2:mem:scoring;MODE=MySQL;DB_CLOSE_DELAY=-1", "sa", "");
        JdbcTemplate jdbc = new JdbcTemplate(dataSource);
        jdbc.execute("DROP TABLE IF EXISTS Vendors");
        jdbc.execute("CREATE TABLE Vendors (Id INT PRIMARY KEY, VendorName VARCHAR(255))");
        jdbc.update("INSERT INTO Vendors VALUES (1, 'Acme Corp')");
        jdbc.update("INSERT INTO Vendors VALUES (2, 'GlobalTech Inc.')");
        jdbc.update("INSERT INTO Vendors VALUES (3, 'Globex')");
        jdbc.update("INSERT INTO Vendors VALUES (4, NULL)");

        SqlProperties properties = new SqlProperties("mysql", Duration.ofSeconds(10), 500,
                Duration.ofMinutes(5), List.of("Vendors"));
        executor = new QueryExecutor(dataSource, new SimilarityRewriter(new MySqlSimilarityDialect()), properties);
    }

    @Test
    void shouldScoreExactMatchHighest() {
        assertEquals(100, scoreOfAcme("Acme Corp"));
        assertEquals(100, scoreOfAcme("acme corp"));
    }

    @Test
    void shouldScorePrefixMatch() {
        assertEquals(90, scoreOfAcme("Acme"));
    }

    @Test
    void shouldScoreInnerMatchByPosition() {
        assertEquals(80, scoreOfAcme("Corp"));
        assertEquals(83, scoreOfAcme("cme"));
    }

    @Test
    void shouldScoreNormalizedEquality() {
        assertEquals(75, scoreOfAcme("AcmeCorp"));
        assertEquals(75, scoreOfAcme("ACME-CORP."));
    }

    @Test
    void shouldScoreSoundAlikeMatch() {
        assertEquals(70, scoreOfAcme("Akme Korp"));
    }

    @Test
    void shouldScoreUnrelatedAsZero() {
        assertEquals(0, scoreOfAcme("Globex"));
    }

    @Test
    void shouldKeepDocumentedScoreOrder() {
        int exact = scoreOfAcme("Acme Corp");
        int prefix = scoreOfAcme("Acme");
        int normalized = scoreOfAcme("AcmeCorp");
        int phonetic = scoreOfAcme("Akme Korp");
        int unrelated = scoreOfAcme("Globex");

        assertTrue(exact > prefix);
        assertTrue(prefix > normalized);
        assertTrue(normalized > phonetic);
        assertTrue(phonetic > unrelated);
    }

    @Test
    void shouldMatchNameDespiteMissingLegalSuffixAndRankItFirst() {
        QueryResult result = executor.query(
                "SELECT VendorName, SIMILARITY(VendorName, 'Global Tech') AS SCORE FROM Vendors "
                        + "WHERE VendorName IS NOT NULL ORDER BY SCORE DESC, Id");

        List<Map<String, Object>> rows = result.rows();
        assertEquals("GlobalTech Inc.", rows.get(0).get("VENDORNAME"));
        assertEquals(75, ((Number) rows.get(0).get("SCORE")).intValue());
        assertEquals(0, ((Number) rows.get(1).get("SCORE")).intValue());
    }

    @Test
    void shouldFilterByThreshold() {
        QueryResult result = executor.query(
                "SELECT VendorName FROM Vendors WHERE SIMILARITY(VendorName, 'acme') >= 60");

        assertEquals(1, result.rowCount());
        assertEquals("Acme Corp", result.rows().get(0).get("VENDORNAME"));
    }

    @Test
    void shouldScoreNullColumnAsZero() {
        QueryResult result = executor.query(
                "SELECT SIMILARITY(VendorName, 'Acme') AS SCORE FROM Vendors WHERE Id = 4");

        assertEquals(0, ((Number) result.rows().get(0).get("SCORE")).intValue());
    }

    private static int scoreOfAcme(String term) {
        String literal = term.replace("'", "''");
        QueryResult result = executor.query(
                "SELECT SIMILARITY(VendorName, '" + literal + "') AS SCORE FROM Vendors WHERE Id = 1");
        return ((Number) result.rows().get(0).get("SCORE")).intValue();
    }
}
