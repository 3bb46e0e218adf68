package com.openforge.invoicemate.consent;

import com.openforge.invoicemate.domain.PendingAction;

/**
 * Performs the side effect of one {@link PendingAction.ActionType}. Called by
 * the {@link ConsentGate} only, and only after the action reached APPROVED.
 */
public interface SensitiveActionExecutor {

    PendingAction.ActionType actionType();

    /**
     * @return a short human-readable summary stored on the action
     * @throws com.openforge.invoicemate.error.InvoiceMateException on failure;
     *         the gate returns the action to DRAFT
     */
    String execute(PendingAction action);
}
