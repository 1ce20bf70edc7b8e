package com.shop.payments.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.shop.payments.domain.PaymentCurrency;
import com.shop.payments.domain.PaymentStatus;
import com.shop.payments.domain.PaymentView;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * REST representation of a payment. The gateway's raw payload is only filled in for admins.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PaymentResponseDto {

    String id;
    String reference;
    String userId;
    String orderId;
    String email;
    BigDecimal amount;
    PaymentCurrency currency;
    PaymentStatus status;
    String authorizationUrl;
    String accessCode;
    String channel;
    String gatewayResponse;
    Instant paidAt;
    Instant createdAt;
    Instant updatedAt;
    String rawPayload;

    public static PaymentResponseDto from(PaymentView view, boolean includeRawPayload) {
        if (view == null) {
            throw new IllegalArgumentException("PaymentView cannot be null");
        }
        return PaymentResponseDto.builder()
                .id(view.getId())
                .reference(view.getReference())
                .userId(view.getUserId())
                .orderId(view.getOrderId())
                .email(view.getEmail())
                .amount(view.getAmount())
                .currency(view.getCurrency())
                .status(view.getStatus())
                .authorizationUrl(view.getAuthorizationUrl())
                .accessCode(view.getAccessCode())
                .channel(view.getChannel())
                .gatewayResponse(view.getGatewayResponse())
                .paidAt(view.getPaidAt())
                .createdAt(view.getCreatedAt())
                .updatedAt(view.getUpdatedAt())
                .rawPayload(includeRawPayload ? view.getRawPayload() : null)
                .build();
    }

    public static PaymentResponseDto from(PaymentView view) {
        return from(view, false);
    }
}
