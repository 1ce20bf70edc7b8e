package com.shop.payments.gateway;

/**
 * Provider has no charge with the given reference.
 */
public class ReferenceNotFoundException extends RuntimeException {

    public ReferenceNotFoundException(String reference) {
        super("Gateway has no transaction with reference " + reference);
    }
}
