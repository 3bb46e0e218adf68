package com.openforge.invoicemate.artifact;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CsvArtifactWriterTest {

    private final CsvArtifactWriter writer = new CsvArtifactWriter();

    @Test
    void shouldWriteHeaderAndRowsInColumnOrder() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("Total", new BigDecimal("2001.00"));
        row.put("InvoiceID", "INV-1001");
        row.put("VendorName", "Acme, Inc.");

        String csv = new String(writer.write(List.of("InvoiceID", "VendorName", "Total"), List.of(row)),
                StandardCharsets.UTF_8);

        String[] lines = csv.split("\n");
        assertEquals("InvoiceID,VendorName,Total", lines[0]);
        assertEquals("INV-1001,\"Acme, Inc.\",2001.00", lines[1]);
    }

    @Test
    void shouldWriteNullAsEmptyField() {
        Map<String, Object> row = new HashMap<>();
        row.put("InvoiceID", "INV-1");
        row.put("PONumber", null);

        String csv = new String(writer.write(List.of("InvoiceID", "PONumber"), List.of(row)), StandardCharsets.UTF_8);

        assertEquals("INV-1,", csv.split("\n")[1]);
    }

    @Test
    void shouldWriteHeaderOnlyWhenNoRows() {
        String csv = new String(writer.write(List.of("InvoiceID", "Total"), List.of()), StandardCharsets.UTF_8);

        assertEquals("InvoiceID,Total", csv.strip());
    }

    @Test
    void shouldWriteEmptyBodyWhenNoColumns() {
        assertEquals(0, writer.write(List.of(), List.of()).length);
    }

    @Test
    void shouldDeriveHeaderFromFirstRowWhenColumnsUnknown() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("a", 1);
        row.put("b", 2);

        String csv = new String(writer.write(List.of(), List.of(row)), StandardCharsets.UTF_8);

        assertEquals("a,b", csv.split("\n")[0]);
    }
}
