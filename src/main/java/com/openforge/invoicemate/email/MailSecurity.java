package com.openforge.invoicemate.email;

/**
 * Transport security for the SMTP connection.
 */
public enum MailSecurity {
    NONE,
    STARTTLS,
    SSL
}
