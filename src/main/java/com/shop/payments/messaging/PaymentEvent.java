package com.shop.payments.messaging;

import com.shop.payments.domain.PaymentCurrency;
import com.shop.payments.domain.PaymentStatus;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Lifecycle event emitted after a ledger change commits. Keyed by payment reference so
 * consumers see the events of one payment in order.
 */
@Value
@Builder
@Jacksonized
public class PaymentEvent {

    String eventId;
    /** PAYMENT_INITIALIZED, PAYMENT_SUCCEEDED, PAYMENT_FAILED, PAYMENT_ABANDONED or ORDER_PAID */
    String eventType;
    String reference;
    String orderId;
    String userId;
    PaymentStatus status;
    BigDecimal amount;
    PaymentCurrency currency;
    String channel;
    /** True when this resolution is the one that marked the order paid. */
    boolean orderMarkedPaid;
    Instant paidAt;
    Instant timestamp;
}
