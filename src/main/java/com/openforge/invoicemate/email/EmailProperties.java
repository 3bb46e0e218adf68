package com.openforge.invoicemate.email;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * invoicemate:
 *   email:
 *     host: smtp-relay.brevo.com
 *     port: 587
 *     security: STARTTLS
 *     username: ${SMTP_USERNAME:}
 *     password: ${SMTP_PASSWORD:}
 *     from: reports@example.com
 *     from-name: InvoiceMate
 *
 * Delivery is disabled while host or username is blank.
 */
@ConfigurationProperties(prefix = "invoicemate.email")
public record EmailProperties(
        String host,
        @DefaultValue("587") int port,
        @DefaultValue("STARTTLS") MailSecurity security,
        String sslTrust,
        String username,
        String password,
        String from,
        @DefaultValue("InvoiceMate") String fromName,
        @DefaultValue("10000") int connectTimeoutMs,
        @DefaultValue("30000") int readTimeoutMs,
        @DefaultValue("30s") Duration attachmentTimeout,
        @DefaultValue("20971520") long maxAttachmentBytes
) {

    public boolean isConfigured() {
        return host != null && !host.isBlank() && username != null && !username.isBlank();
    }

    /** Sender address: explicit "from", else the SMTP username. */
    public String senderAddress() {
        return from != null && !from.isBlank() ? from : username;
    }
}
