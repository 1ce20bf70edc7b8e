package com.shop.payments.persistence.entity;

import com.shop.payments.domain.PaymentCurrency;
import com.shop.payments.domain.PaymentStatus;
import com.shop.payments.domain.PaymentView;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Ledger entry for one charge attempt against an order.
 * <p>
 * {@code activeOrderId} mirrors {@code orderId} while the payment is PENDING or SUCCESS and
 * is cleared once it fails or is abandoned. The unique constraint on it is what keeps an
 * order from ever having two active payments.
 */
@Entity
@Table(name = "payments",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_payment_reference", columnNames = "reference"),
                @UniqueConstraint(name = "uk_payment_active_order", columnNames = "active_order_id")
        },
        indexes = {
                @Index(name = "idx_payment_user_created", columnList = "user_id, created_at"),
                @Index(name = "idx_payment_order", columnList = "order_id"),
                @Index(name = "idx_payment_status_created", columnList = "status, created_at")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentEntity {

    public static final int GATEWAY_RESPONSE_LENGTH = 1000;

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 36)
    private String id;

    @Column(name = "reference", nullable = false, updatable = false, length = 100)
    private String reference;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "order_id", nullable = false)
    private String orderId;

    @Column(name = "active_order_id")
    private String activeOrderId;

    @Column(name = "email")
    private String email;

    @Column(name = "amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(name = "currency", nullable = false, length = 3)
    private PaymentCurrency currency;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private PaymentStatus status;

    @Column(name = "authorization_url", length = 500)
    private String authorizationUrl;

    @Column(name = "access_code")
    private String accessCode;

    @Column(name = "channel")
    private String channel;

    @Column(name = "gateway_response", length = GATEWAY_RESPONSE_LENGTH)
    private String gatewayResponse;

    @Column(name = "raw_payload", columnDefinition = "text")
    private String rawPayload;

    @Column(name = "metadata", columnDefinition = "text")
    private String metadata;

    @Column(name = "paid_at")
    private Instant paidAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID().toString();
        }
        createdAt = Instant.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public PaymentView toView() {
        return PaymentView.builder()
                .id(id)
                .reference(reference)
                .userId(userId)
                .orderId(orderId)
                .email(email)
                .amount(amount)
                .currency(currency)
                .status(status)
                .authorizationUrl(authorizationUrl)
                .accessCode(accessCode)
                .channel(channel)
                .gatewayResponse(gatewayResponse)
                .paidAt(paidAt)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .rawPayload(rawPayload)
                .build();
    }
}
