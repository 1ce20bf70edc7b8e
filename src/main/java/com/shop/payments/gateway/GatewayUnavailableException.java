package com.shop.payments.gateway;

/**
 * Provider could not be reached, timed out, answered 5xx, or its circuit is open.
 * Retryable by the caller; never evidence of a payment outcome.
 */
public class GatewayUnavailableException extends RuntimeException {

    public GatewayUnavailableException(String message) {
        super(message);
    }

    public GatewayUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
