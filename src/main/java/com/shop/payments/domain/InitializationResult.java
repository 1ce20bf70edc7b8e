package com.shop.payments.domain;

import lombok.Value;

/**
 * Result of a payment initialization. {@code created} is false when an existing pending
 * payment was returned instead of starting a new charge.
 */
@Value
public class InitializationResult {
    PaymentView payment;
    boolean created;
}
