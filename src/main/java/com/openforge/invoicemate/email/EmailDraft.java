package com.openforge.invoicemate.email;

import com.openforge.invoicemate.error.ValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * The frozen content of an email awaiting consent. Holds no credentials.
 */
public record EmailDraft(List<String> toEmails, String subject, String body, List<EmailAttachment> attachments) {

    static final Pattern EMAIL_PATTERN = Pattern.compile(
            "^[a-zA-Z0-9._%+\\-]+@[a-zA-Z0-9.\\-]+\\.[a-zA-Z]{2,}$");

    public EmailDraft {
        toEmails = toEmails == null ? List.of() : List.copyOf(toEmails);
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }

    /**
     * Splits a comma or semicolon separated recipient list and checks each address.
     *
     * @throws ValidationException if the list is empty or an address is malformed
     */
    public static List<String> parseRecipients(String recipients) {
        if (recipients == null || recipients.isBlank()) {
            throw new ValidationException("At least one recipient email address is required.");
        }
        List<String> valid = new ArrayList<>();
        List<String> invalid = new ArrayList<>();
        for (String addr : recipients.split("[,;]")) {
            String trimmed = addr.trim();
            if (trimmed.isEmpty()) continue;
            if (EMAIL_PATTERN.matcher(trimmed).matches()) {
                valid.add(trimmed);
            } else {
                invalid.add(trimmed);
            }
        }
        if (!invalid.isEmpty()) {
            throw new ValidationException("Invalid email address: " + String.join(", ", invalid));
        }
        if (valid.isEmpty()) {
            throw new ValidationException("At least one recipient email address is required.");
        }
        return valid;
    }
}
