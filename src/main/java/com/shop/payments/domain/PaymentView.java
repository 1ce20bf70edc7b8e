package com.shop.payments.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Read model of a ledger entry. Returned by the reconciliation engine and cached in Redis
 * once terminal.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class PaymentView {

    String id;
    String reference;
    String userId;
    String orderId;
    String email;
    BigDecimal amount;
    PaymentCurrency currency;
    PaymentStatus status;
    String authorizationUrl;
    String accessCode;
    String channel;
    String gatewayResponse;
    Instant paidAt;
    Instant createdAt;
    Instant updatedAt;
    /** Verbatim gateway payload. Only exposed to admins. */
    String rawPayload;

    @JsonIgnore
    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }
}
