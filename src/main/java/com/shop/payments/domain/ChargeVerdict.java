package com.shop.payments.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a charge as reported by the gateway, either pulled by verification polling or
 * pushed in a signed notification. Only the typed fields are used for decisions;
 * {@code rawPayload} is kept verbatim for audit.
 */
@Value
@Builder
public class ChargeVerdict {

    /** Gateway status string, e.g. "success", "failed", "abandoned", "ongoing". */
    String status;
    String channel;
    String gatewayMessage;
    /** ISO-8601 timestamp as sent by the gateway; may be null. */
    String paidAtRaw;
    String customerEmail;
    /** Charged amount in the smallest currency unit, when the gateway reports it. */
    Long amountMinor;
    String gatewayTransactionId;
    String rawPayload;
}
