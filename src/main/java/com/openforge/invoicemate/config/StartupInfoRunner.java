package com.openforge.invoicemate.config;

import com.openforge.invoicemate.agent.AgentProperties;
import com.openforge.invoicemate.artifact.ArtifactProperties;
import com.openforge.invoicemate.consent.ConsentProperties;
import com.openforge.invoicemate.email.EmailProperties;
import com.openforge.invoicemate.llm.LlmProperties;
import com.openforge.invoicemate.sql.SqlProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Prints a structured startup summary after the application context is fully ready.
 *
 * Checks performed:
 *   - Database: opens a real JDBC connection and reads the server version
 *   - LLM providers: primary + fallback config (API key is masked)
 *   - Query, artifact, email and consent settings as bound
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final DataSource         dataSource;
    private final LlmProperties      llmProperties;
    private final AgentProperties    agentProperties;
    private final SqlProperties      sqlProperties;
    private final ArtifactProperties artifactProperties;
    private final EmailProperties    emailProperties;
    private final ConsentProperties  consentProperties;
    private final Environment        env;

    @Override
    public void run(ApplicationArguments args) {
        LlmProperties.ProviderConfig primary  = llmProperties.primary();
        LlmProperties.ProviderConfig fallback = llmProperties.fallback();

        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║            InvoiceMate  -  Startup Summary               ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Server                                                  ║
                ║    HTTP Port      : {}
                ║    Java Version   : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Database                                                ║
                ║    {}
                ║    SQL Dialect    : {}  timeout={}  max-rows={}
                ║    Tables         : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  LLM Providers                                           ║
                ║    Primary        : {}  [{}]  key={}
                ║    Fallback       : {}  [{}]  key={}
                ║    Max Rounds     : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Artifacts                                               ║
                ║    Bucket         : {}/{}  region={}
                ║    Access Key     : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Email / Consent                                         ║
                ║    SMTP           : {}
                ║    Draft TTL      : {}
                ╚══════════════════════════════════════════════════════════╝
                """,
                env.getProperty("server.port", "8080"),
                System.getProperty("java.version"),

                probeDatabase(),
                sqlProperties.dialect(), sqlProperties.queryTimeout(), sqlProperties.maxRows(),
                sqlProperties.tables(),

                primary.name(), primary.model(), maskKey(primary.apiKey()),
                llmProperties.hasFallback() ? fallback.name() : "(none)",
                llmProperties.hasFallback() ? fallback.model() : "-",
                llmProperties.hasFallback() ? maskKey(fallback.apiKey()) : "-",
                agentProperties.maxRounds(),

                artifactProperties.bucket(), artifactProperties.prefix(), artifactProperties.region(),
                artifactProperties.hasStaticCredentials()
                        ? maskKey(artifactProperties.accessKey()) : "(default credentials chain)",

                emailProperties.isConfigured()
                        ? "%s:%d %s as %s".formatted(emailProperties.host(), emailProperties.port(),
                                emailProperties.security(), emailProperties.senderAddress())
                        : "✘ not configured",
                consentProperties.draftTtl()
        );
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    /**
     * Opens a real JDBC connection and reads the DB server version.
     * Returns a one-line summary or error message.
     */
    private String probeDatabase() {
        try (Connection conn = dataSource.getConnection()) {
            String url     = conn.getMetaData().getURL();
            String product = conn.getMetaData().getDatabaseProductName();
            String version = conn.getMetaData().getDatabaseProductVersion();
            // Strip credentials from the JDBC URL for safe logging
            String safeUrl = url.replaceAll("password=[^&;]*", "password=***");
            return "✔ Connected  " + product + " " + version + "  url=" + safeUrl;
        } catch (SQLException e) {
            log.warn("[Startup] Database probe failed: {}", e.getMessage());
            return "✘ FAILED: " + e.getMessage();
        }
    }

    /**
     * Masks a secret: shows first 6 chars + "..." + last 4 chars.
     * Returns "(not set)" if the key is blank or a placeholder.
     */
    static String maskKey(String key) {
        if (key == null || key.isBlank() || key.startsWith("sk-placeholder")) {
            return "(not set)";
        }
        if (key.length() <= 10) return "***";
        return key.substring(0, 6) + "..." + key.substring(key.length() - 4);
    }
}
