package com.openforge.invoicemate.email;

import jakarta.activation.DataHandler;
import jakarta.mail.AuthenticationFailedException;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.SendFailedException;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import jakarta.mail.util.ByteArrayDataSource;
import lombok.extern.slf4j.Slf4j;

import java.io.UnsupportedEncodingException;
import java.util.Date;
import java.util.List;

/**
 * Sends plain-text mail with attachments over SMTP (Jakarta Mail).
 *
 * The SMTP credentials are read from {@link EmailProperties} here, at send
 * time, and appear nowhere else; error messages are scrubbed of them.
 */
@Slf4j
public class SmtpEmailSender implements EmailSender {

    private final EmailProperties properties;

    public SmtpEmailSender(EmailProperties properties) {
        this.properties = properties;
    }

    @Override
    public void send(EmailDraft draft, List<FetchedAttachment> attachments) {
        if (!properties.isConfigured()) {
            throw new EmailDeliveryException("Email delivery is not configured.", null, false);
        }
        try {
            Session session = MailSessionFactory.createSmtpSession(
                    properties.host(), properties.port(),
                    properties.username(), properties.password(),
                    properties.security(), properties.sslTrust(),
                    properties.connectTimeoutMs(), properties.readTimeoutMs());

            MimeMessage message = new MimeMessage(session);
            message.setFrom(new InternetAddress(properties.senderAddress(), properties.fromName(), "UTF-8"));
            message.setRecipients(Message.RecipientType.TO,
                    InternetAddress.parse(String.join(",", draft.toEmails())));
            message.setSubject(draft.subject(), "UTF-8");
            message.setSentDate(new Date());

            if (attachments.isEmpty()) {
                message.setText(draft.body(), "UTF-8");
            } else {
                MimeMultipart multipart = new MimeMultipart();
                MimeBodyPart text = new MimeBodyPart();
                text.setText(draft.body(), "UTF-8");
                multipart.addBodyPart(text);
                for (FetchedAttachment attachment : attachments) {
                    MimeBodyPart part = new MimeBodyPart();
                    part.setDataHandler(new DataHandler(
                            new ByteArrayDataSource(attachment.content(), attachment.contentType())));
                    part.setFileName(attachment.filename());
                    multipart.addBodyPart(part);
                }
                message.setContent(multipart);
            }

            deliver(message);
            log.info("[Email] Sent '{}' to {} with {} attachment(s)",
                    draft.subject(), draft.toEmails(), attachments.size());
        } catch (AuthenticationFailedException | SendFailedException | AddressException e) {
            throw new EmailDeliveryException("Email was rejected: " + sanitizeError(e.getMessage()), e, false);
        } catch (MessagingException e) {
            throw new EmailDeliveryException("SMTP error: " + sanitizeError(e.getMessage()), e, true);
        } catch (UnsupportedEncodingException e) {
            throw new EmailDeliveryException("Invalid sender name: " + e.getMessage(), e, false);
        }
    }

    String sanitizeError(String message) {
        if (message == null) {
            return "Unknown error";
        }
        String sanitized = message;
        if (properties.username() != null && !properties.username().isBlank()) {
            sanitized = sanitized.replace(properties.username(), "***");
        }
        if (properties.password() != null && !properties.password().isBlank()) {
            sanitized = sanitized.replace(properties.password(), "***");
        }
        return sanitized;
    }

    protected void deliver(MimeMessage message) throws MessagingException {
        Transport.send(message);
    }
}
