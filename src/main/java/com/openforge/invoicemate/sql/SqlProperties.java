package com.openforge.invoicemate.sql;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;

/**
 * invoicemate:
 *   sql:
 *     dialect: mysql            # or sqlserver
 *     query-timeout: 30s
 *     max-rows: 500             # chat queries; exports are unbounded
 *     schema-cache-ttl: 5m
 *     tables: [Invoices, InvoiceLineItems, MasterPOData, Contracts]
 */
@ConfigurationProperties(prefix = "invoicemate.sql")
public record SqlProperties(
        @DefaultValue("mysql") String dialect,
        @DefaultValue("30s") Duration queryTimeout,
        @DefaultValue("500") int maxRows,
        @DefaultValue("5m") Duration schemaCacheTtl,
        @DefaultValue({"Invoices", "InvoiceLineItems", "MasterPOData", "Contracts"}) List<String> tables
) {
}
