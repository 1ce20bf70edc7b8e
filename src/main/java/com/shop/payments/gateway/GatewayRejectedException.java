package com.shop.payments.gateway;

/**
 * Provider refused the request as malformed or not allowed (4xx or {@code status:false}).
 */
public class GatewayRejectedException extends RuntimeException {

    public GatewayRejectedException(String message) {
        super(message);
    }

    public GatewayRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
