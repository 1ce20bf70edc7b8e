package com.shop.payments.gateway;

import com.shop.payments.domain.PaymentCurrency;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Provider fee for charging a given amount.
 */
@Value
public class FeeQuote {
    BigDecimal amount;
    BigDecimal fee;
    BigDecimal total;
    PaymentCurrency currency;
}
