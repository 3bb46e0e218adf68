package com.openforge.invoicemate.artifact;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.openforge.invoicemate.error.SerializationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Serializes query rows to UTF-8 CSV with a header row in column order.
 *
 * No rows with known columns yields a header-only file; no columns at all
 * yields an empty body.
 */
public class CsvArtifactWriter {

    private final CsvMapper csvMapper = new CsvMapper();

    public byte[] write(List<String> columns, List<Map<String, Object>> rows) {
        List<String> header = columns.isEmpty() && !rows.isEmpty()
                ? new ArrayList<>(rows.get(0).keySet())
                : columns;
        if (header.isEmpty()) {
            return new byte[0];
        }

        List<List<Object>> lines = new ArrayList<>(rows.size() + 1);
        lines.add(new ArrayList<>(header));
        for (Map<String, Object> row : rows) {
            List<Object> line = new ArrayList<>(header.size());
            for (String column : header) {
                line.add(row.get(column));
            }
            lines.add(line);
        }

        try {
            return csvMapper.writeValueAsBytes(lines);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to serialize CSV: " + e.getOriginalMessage(), e);
        }
    }
}
