package com.shop.payments.compliance;

import com.shop.payments.domain.PaymentView;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes one {@code [AUDIT]} line per ledger change so every payment can be traced from
 * initialization to its final state. Customer emails are masked.
 */
@Slf4j
@Component
public class ComplianceAuditLogger {

    public void logInitialization(PaymentView payment) {
        log.info("[AUDIT] PAYMENT_INITIALIZED reference={} orderId={} userId={} email={} amount={} currency={}",
                payment.getReference(),
                payment.getOrderId(),
                payment.getUserId(),
                SensitiveDataMasker.maskEmail(payment.getEmail()),
                payment.getAmount(),
                payment.getCurrency());
    }

    public void logResolution(PaymentView payment, String source, boolean orderMarkedPaid) {
        log.info("[AUDIT] PAYMENT_RESOLVED reference={} orderId={} status={} channel={} source={} orderMarkedPaid={}",
                payment.getReference(),
                payment.getOrderId(),
                payment.getStatus(),
                payment.getChannel(),
                source,
                orderMarkedPaid);
    }

    public void logRejectedNotification(String reason) {
        log.warn("[AUDIT] NOTIFICATION_REJECTED reason={}", reason);
    }

    public void logOrderCancelled(String orderId, String userId, int linesRestored) {
        log.info("[AUDIT] ORDER_CANCELLED orderId={} by={} linesRestored={}", orderId, userId, linesRestored);
    }
}
