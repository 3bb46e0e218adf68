package com.openforge.invoicemate.sql;

import com.openforge.invoicemate.error.ExecutionFailedException;
import com.openforge.invoicemate.error.UpstreamTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.jdbc.support.JdbcUtils;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Time;
import java.sql.Timestamp;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs model-authored queries: read-only guard, SIMILARITY expansion, then a
 * bounded JDBC execution whose values are made JSON friendly.
 */
@Slf4j
public class QueryExecutor {

    /** Row limit meaning "no limit", used by exports. */
    public static final int UNLIMITED = 0;

    private final JdbcTemplate      jdbcTemplate;
    private final SimilarityRewriter rewriter;
    private final int               defaultMaxRows;

    public QueryExecutor(DataSource dataSource, SimilarityRewriter rewriter, SqlProperties properties) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.jdbcTemplate.setQueryTimeout((int) Math.max(1, properties.queryTimeout().toSeconds()));
        this.rewriter = rewriter;
        this.defaultMaxRows = properties.maxRows();
    }

    public QueryResult query(String sql) {
        return query(sql, defaultMaxRows);
    }

    /**
     * @param maxRows row limit, or {@link #UNLIMITED}
     */
    public QueryResult query(String sql, int maxRows) {
        String readOnly = ReadOnlyQueryGuard.check(sql);
        RewrittenQuery rewritten = rewriter.rewrite(readOnly);
        if (rewritten.rewritten()) {
            log.info("[Query] Rewritten SQL: {}", rewritten.sql());
        } else {
            log.info("[Query] SQL: {}", rewritten.sql());
        }

        long started = System.currentTimeMillis();
        try {
            QueryResult result = jdbcTemplate.query(con -> {
                PreparedStatement ps = con.prepareStatement(rewritten.sql());
                if (maxRows > 0) {
                    ps.setMaxRows(maxRows + 1);
                }
                return ps;
            }, (ResultSetExtractor<QueryResult>) rs -> extract(rs, maxRows));
            log.info("[Query] {} row(s){} in {} ms", result.rowCount(),
                    result.truncated() ? " (truncated)" : "", System.currentTimeMillis() - started);
            return result;
        } catch (QueryTimeoutException e) {
            throw new UpstreamTimeoutException("The database query timed out. Try narrowing the query.", e);
        } catch (DataAccessException e) {
            String message = e.getMostSpecificCause().getMessage();
            log.warn("[Query] Execution failed: {}", message);
            throw new ExecutionFailedException("Database error: " + message, e);
        }
    }

    private static QueryResult extract(ResultSet rs, int maxRows) throws SQLException {
        ResultSetMetaData md = rs.getMetaData();
        int columnCount = md.getColumnCount();
        List<String> columns = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            columns.add(JdbcUtils.lookupColumnName(md, i));
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        boolean truncated = false;
        while (rs.next()) {
            if (maxRows > 0 && rows.size() == maxRows) {
                truncated = true;
                break;
            }
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= columnCount; i++) {
                row.put(columns.get(i - 1), toJsonValue(JdbcUtils.getResultSetValue(rs, i)));
            }
            rows.add(row);
        }
        return new QueryResult(columns, rows, truncated);
    }

    static Object toJsonValue(Object value) {
        if (value == null) return null;
        if (value instanceof BigDecimal decimal) return decimal.toPlainString();
        if (value instanceof Timestamp ts) return ts.toLocalDateTime().toString();
        if (value instanceof java.sql.Date date) return date.toLocalDate().toString();
        if (value instanceof Time time) return time.toLocalTime().toString();
        if (value instanceof TemporalAccessor temporal) return temporal.toString();
        if (value instanceof byte[] bytes) return Base64.getEncoder().encodeToString(bytes);
        if (value instanceof java.util.UUID uuid) return uuid.toString();
        return value;
    }
}
