package com.shop.payments.api;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * Stable error codes returned in the response envelope, with the HTTP status each maps to.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    ORDER_NOT_FOUND(HttpStatus.NOT_FOUND, "Order not found"),
    PAYMENT_NOT_FOUND(HttpStatus.NOT_FOUND, "Payment not found"),
    PRODUCT_NOT_FOUND(HttpStatus.NOT_FOUND, "Product not found"),
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "Authentication required"),
    FORBIDDEN(HttpStatus.FORBIDDEN, "Not authorized to access this resource"),
    ALREADY_PAID(HttpStatus.CONFLICT, "Order is already paid"),
    ORDER_NOT_PAYABLE(HttpStatus.CONFLICT, "Order cannot be paid in its current status"),
    ORDER_NOT_CANCELLABLE(HttpStatus.CONFLICT, "Cannot cancel order in current status"),
    INSUFFICIENT_STOCK(HttpStatus.CONFLICT, "Insufficient stock"),
    VALIDATION_FAILED(HttpStatus.BAD_REQUEST, "Validation failed"),
    INVALID_SIGNATURE(HttpStatus.BAD_REQUEST, "Invalid signature"),
    MALFORMED_NOTIFICATION(HttpStatus.BAD_REQUEST, "Invalid webhook payload"),
    TOO_MANY_REQUESTS(HttpStatus.TOO_MANY_REQUESTS, "Too many requests, retry later"),
    PAYMENT_INIT_FAILED(HttpStatus.BAD_GATEWAY, "Failed to initialize payment"),
    VERIFICATION_FAILED(HttpStatus.BAD_GATEWAY, "Payment verification failed"),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "Something went wrong");

    private final HttpStatus httpStatus;
    private final String defaultMessage;
}
