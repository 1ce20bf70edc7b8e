package com.shop.payments.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.shop.payments.domain.OrderStatus;
import com.shop.payments.persistence.entity.OrderEntity;
import com.shop.payments.persistence.entity.OrderItem;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * REST representation of an order, including the payment result once paid.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OrderResponseDto {

    String id;
    String userId;
    List<Item> orderItems;
    BigDecimal itemsPrice;
    BigDecimal taxPrice;
    BigDecimal shippingPrice;
    BigDecimal totalPrice;
    boolean paid;
    Instant paidAt;
    String paymentMethod;
    String paymentReference;
    PaymentResult paymentResult;
    OrderStatus status;
    Instant deliveredAt;
    Instant createdAt;
    Instant updatedAt;

    @Value
    public static class Item {
        String product;
        String name;
        int quantity;
        BigDecimal price;
    }

    @Value
    public static class PaymentResult {
        String id;
        String status;
        String updateTime;
        String emailAddress;
    }

    public static OrderResponseDto from(OrderEntity order) {
        List<Item> items = order.getItems().stream()
                .map(OrderResponseDto::item)
                .toList();
        PaymentResult paymentResult = order.isPaid()
                ? new PaymentResult(order.getPaymentResultId(), order.getPaymentResultStatus(),
                order.getPaymentResultUpdateTime(), order.getPaymentResultEmail())
                : null;
        return OrderResponseDto.builder()
                .id(order.getId())
                .userId(order.getUserId())
                .orderItems(items)
                .itemsPrice(order.getItemsPrice())
                .taxPrice(order.getTaxPrice())
                .shippingPrice(order.getShippingPrice())
                .totalPrice(order.getTotalPrice())
                .paid(order.isPaid())
                .paidAt(order.getPaidAt())
                .paymentMethod(order.getPaymentMethod())
                .paymentReference(order.getPaymentReference())
                .paymentResult(paymentResult)
                .status(order.getStatus())
                .deliveredAt(order.getDeliveredAt())
                .createdAt(order.getCreatedAt())
                .updatedAt(order.getUpdatedAt())
                .build();
    }

    private static Item item(OrderItem item) {
        return new Item(item.getProductId(), item.getName(), item.getQuantity(), item.getUnitPrice());
    }
}
