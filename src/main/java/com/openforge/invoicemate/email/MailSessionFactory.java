package com.openforge.invoicemate.email;

import jakarta.mail.Authenticator;
import jakarta.mail.PasswordAuthentication;
import jakarta.mail.Session;

import java.util.Properties;

/**
 * Builds Jakarta Mail sessions for outbound SMTP.
 */
public final class MailSessionFactory {

    private static final String MAIL_PREFIX = "mail.";
    private static final String TRUE_VALUE = "true";

    private MailSessionFactory() {
    }

    /**
     * @param connectTimeout connection timeout in milliseconds
     * @param readTimeout    read timeout in milliseconds
     */
    public static Session createSmtpSession(String host, int port, String username, String password,
                                            MailSecurity security, String sslTrust,
                                            int connectTimeout, int readTimeout) {
        Properties props = new Properties();
        String protocol = (security == MailSecurity.SSL) ? "smtps" : "smtp";
        String prefix = MAIL_PREFIX + protocol + ".";

        props.put("mail.transport.protocol", protocol);
        props.put(prefix + "host", host);
        props.put(prefix + "port", String.valueOf(port));
        props.put(prefix + "auth", TRUE_VALUE);
        props.put(prefix + "connectiontimeout", String.valueOf(connectTimeout));
        props.put(prefix + "timeout", String.valueOf(readTimeout));
        props.put(prefix + "writetimeout", String.valueOf(readTimeout));

        if (security == MailSecurity.SSL) {
            props.put(MAIL_PREFIX + "smtps.ssl.enable", TRUE_VALUE);
        } else if (security == MailSecurity.STARTTLS) {
            props.put(MAIL_PREFIX + "smtp.starttls.enable", TRUE_VALUE);
            props.put(MAIL_PREFIX + "smtp.starttls.required", TRUE_VALUE);
        }
        if (sslTrust != null && !sslTrust.isBlank()) {
            props.put(prefix + "ssl.trust", sslTrust);
        }

        return Session.getInstance(props, createAuthenticator(username, password));
    }

    private static Authenticator createAuthenticator(String username, String password) {
        return new Authenticator() {
            @Override
            protected PasswordAuthentication getPasswordAuthentication() {
                return new PasswordAuthentication(username, password);
            }
        };
    }
}
