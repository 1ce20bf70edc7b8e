package com.shop.payments.gateway;

import com.shop.payments.domain.PaymentCurrency;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Input for {@link PaymentGatewayClient#startCharge(ChargeRequest)}.
 */
@Value
@Builder
public class ChargeRequest {

    String email;
    /** Amount in the main currency unit (e.g. naira, not kobo). */
    BigDecimal amount;
    String reference;
    PaymentCurrency currency;
    Map<String, Object> metadata;
    String callbackUrl;
}
