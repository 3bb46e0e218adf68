package com.openforge.invoicemate.sql;

import com.openforge.invoicemate.sql.SqlScanner.Kind;
import com.openforge.invoicemate.sql.SqlScanner.Token;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqlScannerTest {

    @Test
    void shouldSplitCodeIntoWordsSymbolsAndNumbers() {
        List<Token> tokens = SqlScanner.tokenize("SELECT a.b, 42 FROM t");

        assertEquals(List.of("SELECT", "a", ".", "b", ",", "42", "FROM", "t"),
                tokens.stream().map(Token::text).toList());
        assertEquals(Kind.NUMBER, tokens.get(5).kind());
        assertTrue(tokens.get(2).isSymbol('.'));
    }

    @Test
    void shouldKeepStringLiteralAsSingleTokenWithEscapes() {
        List<Token> tokens = SqlScanner.tokenize("WHERE name = 'O''Brien -- not a comment'");

        Token literal = tokens.get(3);
        assertEquals(Kind.STRING, literal.kind());
        assertTrue(literal.terminated());
        assertEquals("O'Brien -- not a comment", literal.stringValue());
    }

    @Test
    void shouldDecodeNationalStringLiteral() {
        List<Token> tokens = SqlScanner.tokenize("N'Acme'");

        assertEquals(1, tokens.size());
        assertEquals(Kind.STRING, tokens.get(0).kind());
        assertEquals("Acme", tokens.get(0).stringValue());
    }

    @Test
    void shouldRecognizeAllQuotedIdentifierStyles() {
        List<Token> tokens = SqlScanner.tokenize("\"Vendor Name\" [Invoice Total] `Due Date`");

        assertEquals(3, tokens.size());
        tokens.forEach(t -> assertEquals(Kind.QUOTED_IDENTIFIER, t.kind()));
    }

    @Test
    void shouldSkipLineAndBlockComments() {
        List<Token> tokens = SqlScanner.tokenize("SELECT 1 -- SIMILARITY(x, 'y')\n/* DROP TABLE t; */ FROM t");

        assertEquals(List.of("SELECT", "1", "FROM", "t"), tokens.stream().map(Token::text).toList());
    }

    @Test
    void shouldMarkUnterminatedStringLiteral() {
        List<Token> tokens = SqlScanner.tokenize("SELECT 'open");

        Token literal = tokens.get(1);
        assertEquals(Kind.STRING, literal.kind());
        assertFalse(literal.terminated());
    }

    @Test
    void shouldReportOffsetsIntoOriginalText() {
        String sql = "SELECT  VendorName";
        Token word = SqlScanner.tokenize(sql).get(1);

        assertEquals("VendorName", sql.substring(word.start(), word.end()));
    }
}
