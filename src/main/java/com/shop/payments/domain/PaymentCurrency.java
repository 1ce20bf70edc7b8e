package com.shop.payments.domain;

/**
 * Currencies the gateway accepts for checkout.
 */
public enum PaymentCurrency {
    NGN,
    GHS,
    ZAR,
    USD
}
