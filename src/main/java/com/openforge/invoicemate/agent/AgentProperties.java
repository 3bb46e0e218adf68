package com.openforge.invoicemate.agent;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * invoicemate:
 *   agent:
 *     max-rounds: 14
 *     temperature: 0.1
 */
@ConfigurationProperties(prefix = "invoicemate.agent")
public record AgentProperties(
        @DefaultValue("14") int maxRounds,
        @DefaultValue("0.1") double temperature
) {
}
