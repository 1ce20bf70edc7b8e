package com.shop.payments.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.shop.payments.domain.PaymentCurrency;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.hibernate.validator.constraints.URL;

import java.util.Map;

/**
 * Request body for starting a payment on an order. The amount always comes from the order.
 */
@Data
public class InitializePaymentRequestDto {

    @NotBlank(message = "Order ID is required")
    private String orderId;

    @NotBlank(message = "Email is required")
    @Email(message = "Valid email is required")
    private String email;

    /** Defaults to the configured currency (NGN). */
    private PaymentCurrency currency;

    private Map<String, Object> metadata;

    @URL(message = "callback_url must be a valid URL")
    @JsonProperty("callback_url")
    private String callbackUrl;
}
