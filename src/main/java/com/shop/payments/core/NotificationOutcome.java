package com.shop.payments.core;

/**
 * How a signed gateway notification was handled. Every value is acknowledged to the gateway.
 */
public enum NotificationOutcome {
    /** Verdict applied to the ledger (or the payment was already terminal). */
    PROCESSED,
    /** Event type we do not act on. */
    IGNORED,
    /** Reference not in the ledger. */
    UNKNOWN_REFERENCE,
    /** Processing failed after the signature check; logged for follow-up. */
    FAILED
}
