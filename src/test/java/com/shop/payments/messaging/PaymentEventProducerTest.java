package com.shop.payments.messaging;

import com.shop.payments.domain.PaymentCurrency;
import com.shop.payments.domain.PaymentStatus;
import com.shop.payments.domain.PaymentView;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PaymentEventProducerTest {

    @Mock
    private KafkaTemplate<String, PaymentEvent> kafkaTemplate;

    private PaymentEventProducer producer;

    @BeforeEach
    void setUp() {
        producer = new PaymentEventProducer(kafkaTemplate);
        ReflectionTestUtils.setField(producer, "topic", "payment-events");
    }

    private static PaymentView payment(PaymentStatus status) {
        return PaymentView.builder()
                .reference("ORDER-O1-1-abc")
                .orderId("O1")
                .userId("u1")
                .amount(new BigDecimal("5000.00"))
                .currency(PaymentCurrency.NGN)
                .status(status)
                .build();
    }

    @Test
    void successThatPaidTheOrderPublishesOrderPaidToo() {
        when(kafkaTemplate.send(anyString(), anyString(), any(PaymentEvent.class))).thenReturn(new CompletableFuture<>());

        producer.publishResolved(payment(PaymentStatus.SUCCESS), true);

        ArgumentCaptor<PaymentEvent> events = ArgumentCaptor.forClass(PaymentEvent.class);
        verify(kafkaTemplate, times(2)).send(eq("payment-events"), eq("ORDER-O1-1-abc"), events.capture());
        assertThat(events.getAllValues()).extracting(PaymentEvent::getEventType)
                .containsExactly("PAYMENT_SUCCEEDED", PaymentEventProducer.ORDER_PAID);
    }

    @Test
    void failedPaymentPublishesSingleEvent() {
        when(kafkaTemplate.send(anyString(), anyString(), any(PaymentEvent.class))).thenReturn(new CompletableFuture<>());

        producer.publishResolved(payment(PaymentStatus.FAILED), false);

        ArgumentCaptor<PaymentEvent> event = ArgumentCaptor.forClass(PaymentEvent.class);
        verify(kafkaTemplate).send(eq("payment-events"), eq("ORDER-O1-1-abc"), event.capture());
        assertThat(event.getValue().getEventType()).isEqualTo("PAYMENT_FAILED");
        assertThat(event.getValue().isOrderMarkedPaid()).isFalse();
    }

    @Test
    void sendFailureDoesNotPropagate() {
        when(kafkaTemplate.send(anyString(), anyString(), any(PaymentEvent.class)))
                .thenThrow(new IllegalStateException("producer closed"));

        assertThatCode(() -> producer.publishInitialized(payment(PaymentStatus.PENDING))).doesNotThrowAnyException();
    }
}
