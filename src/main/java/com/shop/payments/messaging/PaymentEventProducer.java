package com.shop.payments.messaging;

import com.shop.payments.domain.PaymentStatus;
import com.shop.payments.domain.PaymentView;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Publishes payment lifecycle events to Kafka. Publishing is best effort: the ledger is the
 * source of truth and a failed send is only logged.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentEventProducer {

    public static final String PAYMENT_INITIALIZED = "PAYMENT_INITIALIZED";
    public static final String ORDER_PAID = "ORDER_PAID";

    private final KafkaTemplate<String, PaymentEvent> kafkaTemplate;

    @Value("${shop.payments.kafka.topic:payment-events}")
    private String topic;

    public void publishInitialized(PaymentView payment) {
        send(build(PAYMENT_INITIALIZED, payment, false));
    }

    /**
     * Publishes the payment's terminal event, followed by ORDER_PAID when this resolution
     * is the one that marked the order paid.
     */
    public void publishResolved(PaymentView payment, boolean orderMarkedPaid) {
        send(build(eventTypeFor(payment.getStatus()), payment, orderMarkedPaid));
        if (orderMarkedPaid) {
            send(build(ORDER_PAID, payment, true));
        }
    }

    static String eventTypeFor(PaymentStatus status) {
        return "PAYMENT_" + (status == PaymentStatus.SUCCESS ? "SUCCEEDED" : status.name());
    }

    private PaymentEvent build(String eventType, PaymentView payment, boolean orderMarkedPaid) {
        return PaymentEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .eventType(eventType)
                .reference(payment.getReference())
                .orderId(payment.getOrderId())
                .userId(payment.getUserId())
                .status(payment.getStatus())
                .amount(payment.getAmount())
                .currency(payment.getCurrency())
                .channel(payment.getChannel())
                .orderMarkedPaid(orderMarkedPaid)
                .paidAt(payment.getPaidAt())
                .timestamp(Instant.now())
                .build();
    }

    private void send(PaymentEvent event) {
        log.info("Publishing payment event: reference={}, eventId={}, eventType={}, status={}",
                event.getReference(), event.getEventId(), event.getEventType(), event.getStatus());
        try {
            CompletableFuture<SendResult<String, PaymentEvent>> future =
                    kafkaTemplate.send(topic, event.getReference(), event);
            future.whenComplete((result, ex) -> {
                if (ex != null) {
                    log.error("Failed to publish payment event reference={} eventId={}",
                            event.getReference(), event.getEventId(), ex);
                } else {
                    log.debug("Published payment event eventId={} partition={} offset={}", event.getEventId(),
                            result != null ? result.getRecordMetadata().partition() : null,
                            result != null ? result.getRecordMetadata().offset() : null);
                }
            });
        } catch (Exception e) {
            log.error("Kafka send rejected for reference={} eventId={}", event.getReference(), event.getEventId(), e);
        }
    }
}
