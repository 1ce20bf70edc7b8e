package com.shop.payments.core;

import com.shop.payments.domain.PaymentView;
import lombok.Value;

/**
 * What a call to {@link PaymentResolver#resolve} did. {@code changed} is true only for the
 * one caller whose update moved the payment out of PENDING.
 */
@Value
public class ResolutionOutcome {

    PaymentView payment;
    boolean changed;
    boolean orderMarkedPaid;

    static ResolutionOutcome unchanged(PaymentView payment) {
        return new ResolutionOutcome(payment, false, false);
    }
}
