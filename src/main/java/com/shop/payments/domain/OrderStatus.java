package com.shop.payments.domain;

/**
 * Fulfilment status of an order. Independent of whether the order is paid.
 */
public enum OrderStatus {
    PENDING,
    PROCESSING,
    SHIPPED,
    DELIVERED,
    CANCELLED;

    public boolean isCancellable() {
        return this == PENDING || this == PROCESSING;
    }
}
