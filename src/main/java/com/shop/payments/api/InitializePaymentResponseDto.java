package com.shop.payments.api;

import lombok.Value;

/** Data returned by payment initialization: the payment plus what the client needs to redirect. */
@Value
public class InitializePaymentResponseDto {

    PaymentResponseDto payment;
    String authorizationUrl;
    String accessCode;
    String reference;

    public static InitializePaymentResponseDto from(PaymentResponseDto payment) {
        return new InitializePaymentResponseDto(payment, payment.getAuthorizationUrl(),
                payment.getAccessCode(), payment.getReference());
    }
}
