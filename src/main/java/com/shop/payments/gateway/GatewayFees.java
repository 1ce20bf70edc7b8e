package com.shop.payments.gateway;

import com.shop.payments.domain.PaymentCurrency;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Provider fee schedule: NGN 1.5% capped at 2000, GHS 1.95%, ZAR 2.9%,
 * USD 3.9% plus 0.50.
 */
public final class GatewayFees {

    private static final BigDecimal NGN_CAP = new BigDecimal("2000");

    private GatewayFees() {}

    public static FeeQuote calculate(BigDecimal amount, PaymentCurrency currency) {
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("amount must be non-negative");
        }
        PaymentCurrency effective = currency != null ? currency : PaymentCurrency.NGN;
        BigDecimal fee;
        switch (effective) {
            case GHS:
                fee = amount.multiply(new BigDecimal("0.0195"));
                break;
            case ZAR:
                fee = amount.multiply(new BigDecimal("0.029"));
                break;
            case USD:
                fee = amount.multiply(new BigDecimal("0.039")).add(new BigDecimal("0.50"));
                break;
            case NGN:
            default:
                fee = amount.multiply(new BigDecimal("0.015")).min(NGN_CAP);
                break;
        }
        fee = fee.setScale(2, RoundingMode.HALF_UP);
        BigDecimal total = amount.add(fee).setScale(2, RoundingMode.HALF_UP);
        return new FeeQuote(amount, fee, total, effective);
    }
}
