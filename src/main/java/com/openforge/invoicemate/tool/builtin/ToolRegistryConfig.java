package com.openforge.invoicemate.tool.builtin;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.invoicemate.artifact.ArtifactIssuer;
import com.openforge.invoicemate.consent.ConsentGate;
import com.openforge.invoicemate.sql.QueryExecutor;
import com.openforge.invoicemate.sql.SchemaDescriptionProvider;
import com.openforge.invoicemate.tool.ToolArgumentValidator;
import com.openforge.invoicemate.tool.ToolRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Binds the built-in tools into the registry, in the order the model sees them.
 */
@Configuration
public class ToolRegistryConfig {

    @Bean
    public ToolArgumentValidator toolArgumentValidator(ObjectMapper objectMapper) {
        return new ToolArgumentValidator(objectMapper);
    }

    @Bean
    public ToolRegistry toolRegistry(SchemaDescriptionProvider schemaDescriptionProvider,
                                     ToolArgumentValidator validator,
                                     QueryExecutor queryExecutor,
                                     ArtifactIssuer artifactIssuer,
                                     ConsentGate consentGate,
                                     ObjectMapper objectMapper) {
        List<BuiltinTool> tools = List.of(
                new ExecuteSqlQueryTool(queryExecutor),
                new ExportQueryToCsvTool(queryExecutor, artifactIssuer),
                new VerificationReportTool(artifactIssuer, objectMapper),
                new EmailConsentTool(consentGate, objectMapper));

        ToolRegistry.Builder builder = ToolRegistry.builder(schemaDescriptionProvider::describe).validator(validator);
        tools.forEach(tool -> builder.register(tool.spec(), tool));
        return builder.build();
    }
}
