package com.openforge.invoicemate.sql;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.time.Clock;
import java.util.Locale;

/**
 * Query-side beans: the dialect chosen by {@code invoicemate.sql.dialect},
 * the rewriter bound to it, the executor and the schema description cache.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(SqlProperties.class)
public class SqlConfig {

    @Bean
    public SimilarityDialect similarityDialect(SqlProperties props) {
        SimilarityDialect dialect = switch (props.dialect().toLowerCase(Locale.ROOT)) {
            case "mysql", "h2" -> new MySqlSimilarityDialect();
            case "sqlserver", "mssql" -> new SqlServerSimilarityDialect();
            default -> throw new IllegalStateException(
                    "Unsupported invoicemate.sql.dialect '%s' (expected mysql or sqlserver)".formatted(props.dialect()));
        };
        log.info("[Rewriter] Using {} similarity dialect", dialect.name());
        return dialect;
    }

    @Bean
    public SimilarityRewriter similarityRewriter(SimilarityDialect dialect) {
        return new SimilarityRewriter(dialect);
    }

    @Bean
    public QueryExecutor queryExecutor(DataSource dataSource, SimilarityRewriter rewriter, SqlProperties props) {
        return new QueryExecutor(dataSource, rewriter, props);
    }

    @Bean
    public SchemaDescriptionProvider schemaDescriptionProvider(DataSource dataSource, SqlProperties props) {
        return new SchemaDescriptionProvider(dataSource, props, Clock.systemUTC());
    }
}
