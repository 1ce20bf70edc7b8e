package com.shop.payments.core;

import com.shop.payments.domain.PaymentCurrency;
import com.shop.payments.domain.PaymentStatus;
import com.shop.payments.domain.PaymentView;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.serializer.SerializationException;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for ResolvedPaymentCache with mocked Redis.
 */
@ExtendWith(MockitoExtension.class)
class ResolvedPaymentCacheTest {

    @Mock
    private RedisTemplate<String, PaymentView> redisTemplate;

    @Mock
    private ValueOperations<String, PaymentView> valueOps;

    private ResolvedPaymentCache cache;

    @BeforeEach
    void setUp() {
        lenient().when(redisTemplate.opsForValue()).thenReturn(valueOps);
        cache = new ResolvedPaymentCache(redisTemplate, 24);
    }

    private static PaymentView payment(String reference, PaymentStatus status) {
        return PaymentView.builder()
                .reference(reference)
                .userId("u1")
                .orderId("O1")
                .amount(new BigDecimal("5000.00"))
                .currency(PaymentCurrency.NGN)
                .status(status)
                .createdAt(Instant.now())
                .build();
    }

    @Test
    void getReturnsEmptyWhenRedisReturnsNull() {
        when(valueOps.get("payment:resolved:ref-1")).thenReturn(null);

        assertThat(cache.get("ref-1")).isEmpty();
    }

    @Test
    void getReturnsResolvedPayment() {
        when(valueOps.get("payment:resolved:ref-1")).thenReturn(payment("ref-1", PaymentStatus.SUCCESS));

        Optional<PaymentView> result = cache.get("ref-1");

        assertThat(result).isPresent();
        assertThat(result.get().getStatus()).isEqualTo(PaymentStatus.SUCCESS);
    }

    @Test
    void getIgnoresPendingOrMismatchedEntries() {
        when(valueOps.get("payment:resolved:ref-1")).thenReturn(payment("ref-1", PaymentStatus.PENDING));
        when(valueOps.get("payment:resolved:ref-2")).thenReturn(payment("ref-other", PaymentStatus.FAILED));

        assertThat(cache.get("ref-1")).isEmpty();
        assertThat(cache.get("ref-2")).isEmpty();
    }

    @Test
    void getTreatsDeserializationErrorAsCacheMiss() {
        when(valueOps.get("payment:resolved:ref-3")).thenThrow(new SerializationException("Cannot deserialize PaymentView"));

        assertThat(cache.get("ref-3")).isEmpty();
    }

    @Test
    void getTreatsConnectionErrorAsCacheMiss() {
        when(valueOps.get("payment:resolved:ref-4")).thenThrow(new RuntimeException("Connection refused"));

        assertThat(cache.get("ref-4")).isEmpty();
    }

    @Test
    void storeWritesTerminalPaymentWithTtl() {
        PaymentView failed = payment("ref-5", PaymentStatus.FAILED);

        cache.store(failed);

        verify(valueOps).set(eq("payment:resolved:ref-5"), eq(failed), eq(Duration.ofHours(24)));
    }

    @Test
    void storeSkipsPendingPayment() {
        cache.store(payment("ref-6", PaymentStatus.PENDING));

        verify(valueOps, never()).set(anyString(), any(), any(Duration.class));
    }

    @Test
    void storeSwallowsRedisFailure() {
        doThrow(new RuntimeException("Connection refused"))
                .when(valueOps).set(anyString(), any(), any(Duration.class));

        assertThatCode(() -> cache.store(payment("ref-7", PaymentStatus.SUCCESS))).doesNotThrowAnyException();
    }
}
