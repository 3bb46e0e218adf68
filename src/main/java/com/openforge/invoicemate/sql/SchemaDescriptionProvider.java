package com.openforge.invoicemate.sql;

import com.openforge.invoicemate.error.UpstreamUnavailableException;
import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Renders a plain-text description of the live database schema for the
 * configured tables: columns with type and size, primary keys, foreign keys.
 *
 * The text is cached together with a short content hash ("schema version")
 * and re-derived when the TTL elapses or {@link #refresh()} is called. If the
 * database cannot be reached and a previous description exists, the stale
 * copy is served.
 */
@Slf4j
public class SchemaDescriptionProvider {

    public record SchemaSnapshot(String description, String version, Instant loadedAt) {}

    private final DataSource   dataSource;
    private final List<String> tables;
    private final Duration     ttl;
    private final Clock        clock;

    private volatile SchemaSnapshot snapshot;

    public SchemaDescriptionProvider(DataSource dataSource, SqlProperties properties, Clock clock) {
        this.dataSource = dataSource;
        this.tables     = List.copyOf(properties.tables());
        this.ttl        = properties.schemaCacheTtl();
        this.clock      = clock;
    }

    /** Current description, reloaded if older than the TTL. */
    public String describe() {
        return current().description();
    }

    public String version() {
        return current().version();
    }

    /** Drops the cached copy and introspects again. */
    public synchronized SchemaSnapshot refresh() {
        SchemaSnapshot fresh = load();
        SchemaSnapshot previous = snapshot;
        snapshot = fresh;
        if (previous == null || !previous.version().equals(fresh.version())) {
            log.info("[Schema] Loaded schema description version={} ({} chars)",
                    fresh.version(), fresh.description().length());
        }
        return fresh;
    }

    private SchemaSnapshot current() {
        SchemaSnapshot s = snapshot;
        if (s != null && !isExpired(s)) {
            return s;
        }
        synchronized (this) {
            s = snapshot;
            if (s != null && !isExpired(s)) {
                return s;
            }
            try {
                return refresh();
            } catch (UpstreamUnavailableException e) {
                if (s == null) throw e;
                log.warn("[Schema] Refresh failed, serving cached version={}: {}", s.version(), e.getMessage());
                return s;
            }
        }
    }

    private boolean isExpired(SchemaSnapshot s) {
        return !s.loadedAt().plus(ttl).isAfter(clock.instant());
    }

    // ── Introspection ────────────────────────────────────────────────────────

    private SchemaSnapshot load() {
        try (Connection conn = dataSource.getConnection()) {
            DatabaseMetaData md = conn.getMetaData();
            Map<String, String> actualNames = resolveTableNames(md, conn.getCatalog());

            StringBuilder sb = new StringBuilder();
            for (String table : tables) {
                String actual = actualNames.get(table.toUpperCase(Locale.ROOT));
                if (actual == null) {
                    log.warn("[Schema] Configured table {} not found in database", table);
                    continue;
                }
                describeTable(md, conn.getCatalog(), table, actual, sb);
            }
            String description = sb.toString().strip();
            return new SchemaSnapshot(description, hash(description), clock.instant());
        } catch (SQLException e) {
            throw new UpstreamUnavailableException("Could not read the database schema: " + e.getMessage(), e);
        }
    }

    /** Upper-cased configured name → name as the database stores it. */
    private Map<String, String> resolveTableNames(DatabaseMetaData md, String catalog) throws SQLException {
        Set<String> wanted = new LinkedHashSet<>();
        tables.forEach(t -> wanted.add(t.toUpperCase(Locale.ROOT)));

        Map<String, String> found = new LinkedHashMap<>();
        try (ResultSet rs = md.getTables(catalog, null, "%", null)) {
            while (rs.next()) {
                String name = rs.getString("TABLE_NAME");
                String key = name.toUpperCase(Locale.ROOT);
                if (wanted.contains(key)) {
                    found.putIfAbsent(key, name);
                }
            }
        }
        return found;
    }

    private void describeTable(DatabaseMetaData md, String catalog, String displayName,
                               String actualName, StringBuilder sb) throws SQLException {
        Set<String> primaryKeys = new LinkedHashSet<>();
        try (ResultSet rs = md.getPrimaryKeys(catalog, null, actualName)) {
            while (rs.next()) {
                primaryKeys.add(rs.getString("COLUMN_NAME"));
            }
        }

        sb.append("Table: ").append(displayName).append('\n');
        try (ResultSet rs = md.getColumns(catalog, null, actualName, "%")) {
            while (rs.next()) {
                String column = rs.getString("COLUMN_NAME");
                String type = rs.getString("TYPE_NAME");
                int size = rs.getInt("COLUMN_SIZE");
                boolean nullable = rs.getInt("NULLABLE") != DatabaseMetaData.columnNoNulls;

                sb.append("  - ").append(column).append(' ').append(type);
                if (hasLength(type) && size > 0) {
                    sb.append('(').append(size).append(')');
                }
                if (!nullable) sb.append(" NOT NULL");
                if (primaryKeys.contains(column)) sb.append(" [PK]");
                sb.append('\n');
            }
        }

        List<String> foreignKeys = new ArrayList<>();
        try (ResultSet rs = md.getImportedKeys(catalog, null, actualName)) {
            while (rs.next()) {
                foreignKeys.add(rs.getString("FKCOLUMN_NAME") + " -> "
                        + rs.getString("PKTABLE_NAME") + "." + rs.getString("PKCOLUMN_NAME"));
            }
        }
        if (!foreignKeys.isEmpty()) {
            sb.append("  Foreign keys: ").append(String.join(", ", foreignKeys)).append('\n');
        }
        sb.append('\n');
    }

    private static boolean hasLength(String typeName) {
        String t = typeName == null ? "" : typeName.toUpperCase(Locale.ROOT);
        return t.contains("CHAR") || t.contains("DECIMAL") || t.contains("NUMERIC") || t.contains("BINARY");
    }

    private static String hash(String text) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(text.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest, 0, 6);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
