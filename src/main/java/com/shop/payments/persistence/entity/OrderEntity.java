package com.shop.payments.persistence.entity;

import com.shop.payments.domain.OrderStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Commercial state of an order. Paid fields are only written by the reconciliation engine,
 * through a conditional update.
 */
@Entity
@Table(name = "orders", indexes = {
        @Index(name = "idx_order_user_created", columnList = "user_id, created_at"),
        @Index(name = "idx_order_status", columnList = "status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 36)
    private String id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "order_items", joinColumns = @JoinColumn(name = "order_id"))
    @OrderColumn(name = "line_no")
    @Builder.Default
    private List<OrderItem> items = new ArrayList<>();

    @Column(name = "items_price", nullable = false, precision = 19, scale = 2)
    private BigDecimal itemsPrice;

    @Column(name = "tax_price", nullable = false, precision = 19, scale = 2)
    private BigDecimal taxPrice;

    @Column(name = "shipping_price", nullable = false, precision = 19, scale = 2)
    private BigDecimal shippingPrice;

    @Column(name = "total_price", nullable = false, precision = 19, scale = 2)
    private BigDecimal totalPrice;

    @Column(name = "paid", nullable = false)
    private boolean paid;

    @Column(name = "paid_at")
    private Instant paidAt;

    @Column(name = "payment_method")
    private String paymentMethod;

    @Column(name = "payment_reference", length = 100)
    private String paymentReference;

    @Column(name = "payment_result_id")
    private String paymentResultId;

    @Column(name = "payment_result_status")
    private String paymentResultStatus;

    @Column(name = "payment_result_update_time")
    private String paymentResultUpdateTime;

    @Column(name = "payment_result_email")
    private String paymentResultEmail;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private OrderStatus status;

    @Column(name = "delivered_at")
    private Instant deliveredAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID().toString();
        }
        if (status == null) {
            status = OrderStatus.PENDING;
        }
        createdAt = Instant.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
