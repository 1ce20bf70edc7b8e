package com.shop.payments.domain;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Input for starting a payment on an order. {@code currency}, {@code metadata} and
 * {@code callbackUrl} are optional.
 */
@Value
@Builder
public class InitializePaymentCommand {

    String orderId;
    String requestingUserId;
    String email;
    PaymentCurrency currency;
    Map<String, Object> metadata;
    String callbackUrl;
}
