package com.openforge.invoicemate.consent;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * invoicemate.consent.draft-ttl: how long a draft may wait for approval.
 */
@ConfigurationProperties(prefix = "invoicemate.consent")
public record ConsentProperties(
        @DefaultValue("30m") Duration draftTtl
) {
}
