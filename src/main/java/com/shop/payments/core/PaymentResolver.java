package com.shop.payments.core;

import com.shop.payments.api.ErrorCode;
import com.shop.payments.api.PaymentException;
import com.shop.payments.domain.ChargeVerdict;
import com.shop.payments.domain.PaymentStatus;
import com.shop.payments.domain.PaymentView;
import com.shop.payments.gateway.CurrencyUnits;
import com.shop.payments.persistence.entity.PaymentEntity;
import com.shop.payments.persistence.repository.OrderRepository;
import com.shop.payments.persistence.repository.PaymentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Applies a gateway verdict to the ledger. This is the only code that changes a payment's
 * status or marks an order paid, and it does both in one transaction.
 * <p>
 * Both writes are conditional updates: the payment only moves if it is still PENDING and the
 * order is only marked paid if it is not paid yet. Concurrent resolutions of the same
 * reference therefore converge: exactly one caller sees {@code changed = true}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentResolver {

    static final String AMOUNT_MISMATCH = "AMOUNT_MISMATCH";

    /** Length of the plain string columns the verdict is copied into. */
    private static final int TEXT_COLUMN_LENGTH = 255;

    private static final Set<String> IN_FLIGHT = Set.of("pending", "ongoing", "processing", "queued");

    private final PaymentRepository paymentRepository;
    private final OrderRepository orderRepository;

    @Transactional
    public ResolutionOutcome resolve(String reference, ChargeVerdict verdict) {
        PaymentEntity payment = paymentRepository.findByReference(reference)
                .orElseThrow(() -> new PaymentException(ErrorCode.PAYMENT_NOT_FOUND,
                        "Payment not found: " + reference));

        if (payment.getStatus().isTerminal()) {
            log.debug("Payment already resolved: reference={}, status={}", reference, payment.getStatus());
            return ResolutionOutcome.unchanged(payment.toView());
        }

        Optional<PaymentStatus> mapped = mapStatus(verdict.getStatus());
        if (mapped.isEmpty()) {
            log.info("Gateway still processing reference={} (status={}); payment stays PENDING",
                    reference, verdict.getStatus());
            return ResolutionOutcome.unchanged(payment.toView());
        }

        PaymentStatus next = mapped.get();
        String gatewayResponse = clip(verdict.getGatewayMessage(), PaymentEntity.GATEWAY_RESPONSE_LENGTH);
        String channel = clip(verdict.getChannel(), TEXT_COLUMN_LENGTH);
        if (next == PaymentStatus.SUCCESS && amountDiffers(payment, verdict)) {
            log.error("Amount mismatch for reference={}: ledger={} ({} minor), gateway reported {} minor",
                    reference, payment.getAmount(), CurrencyUnits.toMinorUnits(payment.getAmount()),
                    verdict.getAmountMinor());
            next = PaymentStatus.FAILED;
            gatewayResponse = AMOUNT_MISMATCH;
        }

        Instant now = Instant.now();
        Instant paidAt = next == PaymentStatus.SUCCESS ? parsePaidAt(verdict.getPaidAtRaw(), now) : null;
        String activeOrderId = next.holdsOrder() ? payment.getOrderId() : null;

        int updated = paymentRepository.resolvePending(reference, PaymentStatus.PENDING, next,
                channel, gatewayResponse, verdict.getRawPayload(), paidAt, activeOrderId, now);
        if (updated == 0) {
            log.info("Payment reference={} was resolved concurrently; keeping the first verdict", reference);
            return ResolutionOutcome.unchanged(reload(reference));
        }
        log.info("Payment resolved: reference={}, {} -> {}", reference, PaymentStatus.PENDING, next);

        boolean orderMarkedPaid = false;
        if (next == PaymentStatus.SUCCESS) {
            String orderId = payment.getOrderId();
            int marked = orderRepository.markPaid(orderId, paidAt, channel, reference,
                    clip(verdict.getGatewayTransactionId(), TEXT_COLUMN_LENGTH),
                    clip(verdict.getStatus(), TEXT_COLUMN_LENGTH),
                    clip(verdict.getPaidAtRaw(), TEXT_COLUMN_LENGTH),
                    clip(verdict.getCustomerEmail(), TEXT_COLUMN_LENGTH), now);
            if (marked == 1) {
                orderMarkedPaid = true;
                log.info("Order marked paid: orderId={}, reference={}, paidAt={}", orderId, reference, paidAt);
            } else if (!orderRepository.existsById(orderId)) {
                log.error("InternalInconsistency: payment reference={} succeeded but order {} does not exist",
                        reference, orderId);
            } else {
                log.warn("Order {} was already paid; reference={} did not change it", orderId, reference);
            }
        }
        return new ResolutionOutcome(reload(reference), true, orderMarkedPaid);
    }

    /**
     * Gateway status to ledger status. Empty means the charge is still in flight.
     */
    static Optional<PaymentStatus> mapStatus(String gatewayStatus) {
        String status = gatewayStatus == null ? "" : gatewayStatus.trim().toLowerCase(Locale.ROOT);
        if ("success".equals(status)) {
            return Optional.of(PaymentStatus.SUCCESS);
        }
        if ("abandoned".equals(status)) {
            return Optional.of(PaymentStatus.ABANDONED);
        }
        if (IN_FLIGHT.contains(status)) {
            return Optional.empty();
        }
        return Optional.of(PaymentStatus.FAILED);
    }

    private static boolean amountDiffers(PaymentEntity payment, ChargeVerdict verdict) {
        if (verdict.getAmountMinor() == null) {
            return false;
        }
        return CurrencyUnits.toMinorUnits(payment.getAmount()) != verdict.getAmountMinor();
    }

    static Instant parsePaidAt(String raw, Instant fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return OffsetDateTime.parse(raw).toInstant();
        } catch (DateTimeParseException e) {
            log.warn("Unparseable paid_at '{}' from gateway, using resolution time", raw);
            return fallback;
        }
    }

    /** Gateway text is cut to the column width; the full text stays in the raw payload. */
    static String clip(String value, int maxLength) {
        return value == null || value.length() <= maxLength ? value : value.substring(0, maxLength);
    }

    private PaymentView reload(String reference) {
        return paymentRepository.findByReference(reference)
                .map(PaymentEntity::toView)
                .orElseThrow(() -> new IllegalStateException("Payment vanished during resolution: " + reference));
    }
}
