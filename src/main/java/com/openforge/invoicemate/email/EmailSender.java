package com.openforge.invoicemate.email;

import java.util.List;

/**
 * Outbound email transport.
 */
public interface EmailSender {

    /**
     * @throws EmailDeliveryException if the message was not accepted
     */
    void send(EmailDraft draft, List<FetchedAttachment> attachments);
}
