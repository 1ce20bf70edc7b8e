package com.shop.payments.domain;

/**
 * Lifecycle states of a ledger entry. A payment starts {@link #PENDING} and moves exactly
 * once to one of the terminal states; nothing leaves a terminal state.
 */
public enum PaymentStatus {
    /** Charge started at the gateway, verdict not yet applied. */
    PENDING,
    /** Gateway confirmed the charge; the order has been marked paid. */
    SUCCESS,
    /** Gateway declined the charge, or the reported amount did not match the ledger. */
    FAILED,
    /** Customer left the checkout without completing it. */
    ABANDONED;

    public boolean isTerminal() {
        return this != PENDING;
    }

    /** Statuses that occupy the single active slot of an order. */
    public boolean holdsOrder() {
        return this == PENDING || this == SUCCESS;
    }
}
